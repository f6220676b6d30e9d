package com.flagship.content_graph.content;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Entity
@Table(name = "media_locations")
@Getter
@Setter
@ToString(callSuper = true)
@NoArgsConstructor
public class MediaLocationEntity extends TypedEntity {

    @Column(name = "http_media_location_id")
    private String httpMediaLocationId;

    @Column(name = "joystream_media_location_id")
    private String joystreamMediaLocationId;
}
