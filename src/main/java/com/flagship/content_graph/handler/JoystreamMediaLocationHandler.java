package com.flagship.content_graph.handler;

import com.flagship.content_graph.content.JoystreamMediaLocationEntity;
import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.properties.JoystreamMediaLocationProperties;
import com.flagship.content_graph.store.EntityStore;
import org.springframework.stereotype.Component;

@Component
public class JoystreamMediaLocationHandler extends AbstractEntityHandler<JoystreamMediaLocationEntity, JoystreamMediaLocationProperties> {

    public JoystreamMediaLocationHandler(EntityStore store) {
        super(store, KnownClass.JOYSTREAM_MEDIA_LOCATION, JoystreamMediaLocationEntity.class, JoystreamMediaLocationProperties.class, JoystreamMediaLocationEntity::new);
    }

    @Override
    protected void apply(JoystreamMediaLocationEntity row, JoystreamMediaLocationProperties properties) {
        assign(properties.dataObjectId(), row::setDataObjectId);
    }
}
