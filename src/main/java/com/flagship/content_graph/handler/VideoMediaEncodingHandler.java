package com.flagship.content_graph.handler;

import com.flagship.content_graph.content.VideoMediaEncodingEntity;
import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.properties.VideoMediaEncodingProperties;
import com.flagship.content_graph.store.EntityStore;
import org.springframework.stereotype.Component;

@Component
public class VideoMediaEncodingHandler extends AbstractEntityHandler<VideoMediaEncodingEntity, VideoMediaEncodingProperties> {

    public VideoMediaEncodingHandler(EntityStore store) {
        super(store, KnownClass.VIDEO_MEDIA_ENCODING, VideoMediaEncodingEntity.class, VideoMediaEncodingProperties.class, VideoMediaEncodingEntity::new);
    }

    @Override
    protected void apply(VideoMediaEncodingEntity row, VideoMediaEncodingProperties properties) {
        assign(properties.name(), row::setName);
    }
}
