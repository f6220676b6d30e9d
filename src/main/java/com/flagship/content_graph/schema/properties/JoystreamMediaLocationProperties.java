package com.flagship.content_graph.schema.properties;

import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.PropertyBag;

import java.util.List;

public record JoystreamMediaLocationProperties(String dataObjectId) implements EntityProperties {

    public static JoystreamMediaLocationProperties from(PropertyBag bag) {
        return new JoystreamMediaLocationProperties(bag.text("dataObjectId"));
    }

    @Override
    public KnownClass knownClass() {
        return KnownClass.JOYSTREAM_MEDIA_LOCATION;
    }

    @Override
    public List<ReferenceProperty> references() {
        return List.of();
    }
}
