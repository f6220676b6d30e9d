package com.flagship.content_graph.content;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Entity
@Table(name = "http_media_locations")
@Getter
@Setter
@ToString(callSuper = true)
@NoArgsConstructor
public class HttpMediaLocationEntity extends TypedEntity {

    @Column(name = "url")
    private String url;

    @Column(name = "port")
    private Integer port;
}
