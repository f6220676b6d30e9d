package com.flagship.content_graph.handler;

import com.flagship.content_graph.content.HttpMediaLocationEntity;
import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.properties.HttpMediaLocationProperties;
import com.flagship.content_graph.store.EntityStore;
import org.springframework.stereotype.Component;

@Component
public class HttpMediaLocationHandler extends AbstractEntityHandler<HttpMediaLocationEntity, HttpMediaLocationProperties> {

    public HttpMediaLocationHandler(EntityStore store) {
        super(store, KnownClass.HTTP_MEDIA_LOCATION, HttpMediaLocationEntity.class, HttpMediaLocationProperties.class, HttpMediaLocationEntity::new);
    }

    @Override
    protected void apply(HttpMediaLocationEntity row, HttpMediaLocationProperties properties) {
        assign(properties.url(), row::setUrl);
        assign(properties.port(), row::setPort);
    }
}
