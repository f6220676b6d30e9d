package com.flagship.content_graph.handler;

import com.flagship.content_graph.content.UserDefinedLicenseEntity;
import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.properties.UserDefinedLicenseProperties;
import com.flagship.content_graph.store.EntityStore;
import org.springframework.stereotype.Component;

@Component
public class UserDefinedLicenseHandler extends AbstractEntityHandler<UserDefinedLicenseEntity, UserDefinedLicenseProperties> {

    public UserDefinedLicenseHandler(EntityStore store) {
        super(store, KnownClass.USER_DEFINED_LICENSE, UserDefinedLicenseEntity.class, UserDefinedLicenseProperties.class, UserDefinedLicenseEntity::new);
    }

    @Override
    protected void apply(UserDefinedLicenseEntity row, UserDefinedLicenseProperties properties) {
        assign(properties.content(), row::setContent);
    }
}
