package com.flagship.content_graph.content;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * A published video. Reference columns hold the ids of the channel,
 * category, language, media and license entities.
 */
@Entity
@Table(name = "videos")
@Getter
@Setter
@ToString(callSuper = true)
@NoArgsConstructor
public class VideoEntity extends TypedEntity {

    @Column(name = "channel_id")
    private String channelId;

    @Column(name = "category_id")
    private String categoryId;

    @Column(name = "title")
    private String title;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "duration")
    private Long duration;

    @Column(name = "skippable_intro_duration")
    private Long skippableIntroDuration;

    @Column(name = "thumbnail_url")
    private String thumbnailUrl;

    @Column(name = "language_id")
    private String languageId;

    @Column(name = "media_id")
    private String mediaId;

    @Column(name = "has_marketing")
    private Boolean hasMarketing;

    @Column(name = "published_before_joystream")
    private Long publishedBeforeJoystream;

    @Column(name = "is_public")
    private Boolean isPublic;

    @Column(name = "is_curated")
    private Boolean isCurated;

    @Column(name = "is_explicit")
    private Boolean isExplicit;

    @Column(name = "license_id")
    private String licenseId;
}
