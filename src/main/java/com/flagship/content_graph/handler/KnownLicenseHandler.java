package com.flagship.content_graph.handler;

import com.flagship.content_graph.content.KnownLicenseEntity;
import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.properties.KnownLicenseProperties;
import com.flagship.content_graph.store.EntityStore;
import org.springframework.stereotype.Component;

@Component
public class KnownLicenseHandler extends AbstractEntityHandler<KnownLicenseEntity, KnownLicenseProperties> {

    public KnownLicenseHandler(EntityStore store) {
        super(store, KnownClass.KNOWN_LICENSE, KnownLicenseEntity.class, KnownLicenseProperties.class, KnownLicenseEntity::new);
    }

    @Override
    protected void apply(KnownLicenseEntity row, KnownLicenseProperties properties) {
        assign(properties.code(), row::setCode);
        assign(properties.name(), row::setName);
        assign(properties.description(), row::setDescription);
        assign(properties.url(), row::setUrl);
    }
}
