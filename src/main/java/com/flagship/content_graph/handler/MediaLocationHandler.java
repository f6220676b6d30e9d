package com.flagship.content_graph.handler;

import com.flagship.content_graph.content.MediaLocationEntity;
import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.properties.MediaLocationProperties;
import com.flagship.content_graph.store.EntityStore;
import org.springframework.stereotype.Component;

@Component
public class MediaLocationHandler extends AbstractEntityHandler<MediaLocationEntity, MediaLocationProperties> {

    public MediaLocationHandler(EntityStore store) {
        super(store, KnownClass.MEDIA_LOCATION, MediaLocationEntity.class, MediaLocationProperties.class, MediaLocationEntity::new);
    }

    @Override
    protected void apply(MediaLocationEntity row, MediaLocationProperties properties) {
        assignReference(properties.httpMediaLocation(), row::setHttpMediaLocationId);
        assignReference(properties.joystreamMediaLocation(), row::setJoystreamMediaLocationId);
    }
}
