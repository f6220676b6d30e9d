package com.flagship.content_graph.schema.properties;

import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.PropertyBag;

import java.util.List;

public record CategoryProperties(String name, String description) implements EntityProperties {

    public static CategoryProperties from(PropertyBag bag) {
        return new CategoryProperties(bag.text("name"), bag.text("description"));
    }

    @Override
    public KnownClass knownClass() {
        return KnownClass.CATEGORY;
    }

    @Override
    public List<ReferenceProperty> references() {
        return List.of();
    }
}
