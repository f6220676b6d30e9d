package com.flagship.content_graph.content;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Entity
@Table(name = "video_media_encodings")
@Getter
@Setter
@ToString(callSuper = true)
@NoArgsConstructor
public class VideoMediaEncodingEntity extends TypedEntity {

    @Column(name = "name")
    private String name;
}
