package com.flagship.content_graph.content;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Entity
@Table(name = "channels")
@Getter
@Setter
@ToString(callSuper = true)
@NoArgsConstructor
public class ChannelEntity extends TypedEntity {

    @Column(name = "handle")
    private String handle;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "cover_photo_url")
    private String coverPhotoUrl;

    @Column(name = "avatar_photo_url")
    private String avatarPhotoUrl;

    @Column(name = "is_public")
    private Boolean isPublic;

    @Column(name = "is_curated")
    private Boolean isCurated;

    @Column(name = "language_id")
    private String languageId;
}
