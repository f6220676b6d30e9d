package com.flagship.content_graph.schema.properties;

import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.PropertyBag;

import java.util.List;

public record UserDefinedLicenseProperties(String content) implements EntityProperties {

    public static UserDefinedLicenseProperties from(PropertyBag bag) {
        return new UserDefinedLicenseProperties(bag.text("content"));
    }

    @Override
    public KnownClass knownClass() {
        return KnownClass.USER_DEFINED_LICENSE;
    }

    @Override
    public List<ReferenceProperty> references() {
        return List.of();
    }
}
