package com.flagship.content_graph.content;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Entity
@Table(name = "joystream_media_locations")
@Getter
@Setter
@ToString(callSuper = true)
@NoArgsConstructor
public class JoystreamMediaLocationEntity extends TypedEntity {

    @Column(name = "data_object_id")
    private String dataObjectId;
}
