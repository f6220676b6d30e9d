package com.flagship.content_graph.schema.properties;

import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.PropertyBag;
import com.flagship.content_graph.schema.Reference;

import java.util.List;

public record MediaLocationProperties(Reference httpMediaLocation, Reference joystreamMediaLocation)
        implements EntityProperties {

    public static MediaLocationProperties from(PropertyBag bag) {
        return new MediaLocationProperties(
                bag.reference("httpMediaLocation"),
                bag.reference("joystreamMediaLocation"));
    }

    @Override
    public KnownClass knownClass() {
        return KnownClass.MEDIA_LOCATION;
    }

    @Override
    public List<ReferenceProperty> references() {
        return ReferenceProperty.present(
                ReferenceProperty.of("httpMediaLocation", KnownClass.HTTP_MEDIA_LOCATION, httpMediaLocation),
                ReferenceProperty.of("joystreamMediaLocation", KnownClass.JOYSTREAM_MEDIA_LOCATION, joystreamMediaLocation));
    }
}
