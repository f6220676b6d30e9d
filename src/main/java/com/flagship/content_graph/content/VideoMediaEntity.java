package com.flagship.content_graph.content;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.math.BigInteger;

@Entity
@Table(name = "video_media")
@Getter
@Setter
@ToString(callSuper = true)
@NoArgsConstructor
public class VideoMediaEntity extends TypedEntity {

    @Column(name = "encoding_id")
    private String encodingId;

    @Column(name = "pixel_width")
    private Integer pixelWidth;

    @Column(name = "pixel_height")
    private Integer pixelHeight;

    /**
     * Unsigned 64-bit, does not fit a {@code bigint}.
     */
    @Column(name = "size_bytes", precision = 20, scale = 0)
    private BigInteger size;

    @Column(name = "location_id")
    private String locationId;
}
