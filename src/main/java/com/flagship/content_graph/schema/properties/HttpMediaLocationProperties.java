package com.flagship.content_graph.schema.properties;

import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.PropertyBag;

import java.util.List;

public record HttpMediaLocationProperties(String url, Integer port) implements EntityProperties {

    public static HttpMediaLocationProperties from(PropertyBag bag) {
        return new HttpMediaLocationProperties(bag.text("url"), bag.uint16("port"));
    }

    @Override
    public KnownClass knownClass() {
        return KnownClass.HTTP_MEDIA_LOCATION;
    }

    @Override
    public List<ReferenceProperty> references() {
        return List.of();
    }
}
