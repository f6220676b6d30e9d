package com.flagship.content_graph.handler;

import com.flagship.content_graph.content.LicenseEntity;
import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.properties.LicenseProperties;
import com.flagship.content_graph.store.EntityStore;
import org.springframework.stereotype.Component;

@Component
public class LicenseHandler extends AbstractEntityHandler<LicenseEntity, LicenseProperties> {

    public LicenseHandler(EntityStore store) {
        super(store, KnownClass.LICENSE, LicenseEntity.class, LicenseProperties.class, LicenseEntity::new);
    }

    @Override
    protected void apply(LicenseEntity row, LicenseProperties properties) {
        assignReference(properties.knownLicense(), row::setKnownLicenseId);
        assignReference(properties.userDefinedLicense(), row::setUserDefinedLicenseId);
    }
}
