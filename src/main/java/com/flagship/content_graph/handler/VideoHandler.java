package com.flagship.content_graph.handler;

import com.flagship.content_graph.content.VideoEntity;
import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.properties.VideoProperties;
import com.flagship.content_graph.store.EntityStore;
import org.springframework.stereotype.Component;

@Component
public class VideoHandler extends AbstractEntityHandler<VideoEntity, VideoProperties> {

    public VideoHandler(EntityStore store) {
        super(store, KnownClass.VIDEO, VideoEntity.class, VideoProperties.class, VideoEntity::new);
    }

    @Override
    protected void apply(VideoEntity row, VideoProperties properties) {
        assignReference(properties.channel(), row::setChannelId);
        assignReference(properties.category(), row::setCategoryId);
        assign(properties.title(), row::setTitle);
        assign(properties.description(), row::setDescription);
        assign(properties.duration(), row::setDuration);
        assign(properties.skippableIntroDuration(), row::setSkippableIntroDuration);
        assign(properties.thumbnailUrl(), row::setThumbnailUrl);
        assignReference(properties.language(), row::setLanguageId);
        assignReference(properties.media(), row::setMediaId);
        assign(properties.hasMarketing(), row::setHasMarketing);
        assign(properties.publishedBeforeJoystream(), row::setPublishedBeforeJoystream);
        assign(properties.isPublic(), row::setIsPublic);
        assign(properties.isCurated(), row::setIsCurated);
        assign(properties.isExplicit(), row::setIsExplicit);
        assignReference(properties.license(), row::setLicenseId);
    }
}
