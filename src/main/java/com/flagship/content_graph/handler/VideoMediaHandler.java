package com.flagship.content_graph.handler;

import com.flagship.content_graph.content.VideoMediaEntity;
import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.properties.VideoMediaProperties;
import com.flagship.content_graph.store.EntityStore;
import org.springframework.stereotype.Component;

@Component
public class VideoMediaHandler extends AbstractEntityHandler<VideoMediaEntity, VideoMediaProperties> {

    public VideoMediaHandler(EntityStore store) {
        super(store, KnownClass.VIDEO_MEDIA, VideoMediaEntity.class, VideoMediaProperties.class, VideoMediaEntity::new);
    }

    @Override
    protected void apply(VideoMediaEntity row, VideoMediaProperties properties) {
        assignReference(properties.encoding(), row::setEncodingId);
        assign(properties.pixelWidth(), row::setPixelWidth);
        assign(properties.pixelHeight(), row::setPixelHeight);
        assign(properties.size(), row::setSize);
        assignReference(properties.location(), row::setLocationId);
    }
}
