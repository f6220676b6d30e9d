package com.flagship.content_graph.schema.properties;

import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.PropertyBag;

import java.util.List;

public record KnownLicenseProperties(String code, String name, String description, String url)
        implements EntityProperties {

    public static KnownLicenseProperties from(PropertyBag bag) {
        return new KnownLicenseProperties(
                bag.text("code"),
                bag.text("name"),
                bag.text("description"),
                bag.text("url"));
    }

    @Override
    public KnownClass knownClass() {
        return KnownClass.KNOWN_LICENSE;
    }

    @Override
    public List<ReferenceProperty> references() {
        return List.of();
    }
}
