package com.flagship.content_graph.content;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Entity
@Table(name = "featured_videos")
@Getter
@Setter
@ToString(callSuper = true)
@NoArgsConstructor
public class FeaturedVideoEntity extends TypedEntity {

    @Column(name = "video_id")
    private String videoId;
}
