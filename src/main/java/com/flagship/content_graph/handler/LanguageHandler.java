package com.flagship.content_graph.handler;

import com.flagship.content_graph.content.LanguageEntity;
import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.properties.LanguageProperties;
import com.flagship.content_graph.store.EntityStore;
import org.springframework.stereotype.Component;

@Component
public class LanguageHandler extends AbstractEntityHandler<LanguageEntity, LanguageProperties> {

    public LanguageHandler(EntityStore store) {
        super(store, KnownClass.LANGUAGE, LanguageEntity.class, LanguageProperties.class, LanguageEntity::new);
    }

    @Override
    protected void apply(LanguageEntity row, LanguageProperties properties) {
        assign(properties.name(), row::setName);
        assign(properties.code(), row::setCode);
    }
}
