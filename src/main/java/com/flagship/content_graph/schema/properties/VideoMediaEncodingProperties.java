package com.flagship.content_graph.schema.properties;

import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.PropertyBag;

import java.util.List;

public record VideoMediaEncodingProperties(String name) implements EntityProperties {

    public static VideoMediaEncodingProperties from(PropertyBag bag) {
        return new VideoMediaEncodingProperties(bag.text("name"));
    }

    @Override
    public KnownClass knownClass() {
        return KnownClass.VIDEO_MEDIA_ENCODING;
    }

    @Override
    public List<ReferenceProperty> references() {
        return List.of();
    }
}
