package com.flagship.content_graph.schema.properties;

import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.PropertyBag;

import java.util.List;

public record LanguageProperties(String name, String code) implements EntityProperties {

    public static LanguageProperties from(PropertyBag bag) {
        return new LanguageProperties(bag.text("name"), bag.text("code"));
    }

    @Override
    public KnownClass knownClass() {
        return KnownClass.LANGUAGE;
    }

    @Override
    public List<ReferenceProperty> references() {
        return List.of();
    }
}
