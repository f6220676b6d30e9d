package com.flagship.content_graph.schema.properties;

import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.PropertyBag;
import com.flagship.content_graph.schema.Reference;

import java.util.List;

public record ChannelProperties(
        String handle,
        String description,
        String coverPhotoUrl,
        String avatarPhotoUrl,
        Boolean isPublic,
        Boolean isCurated,
        Reference language
) implements EntityProperties {

    public static ChannelProperties from(PropertyBag bag) {
        return new ChannelProperties(
                bag.text("handle"),
                bag.text("description"),
                bag.text("coverPhotoUrl"),
                bag.text("avatarPhotoUrl"),
                bag.bool("isPublic"),
                bag.bool("isCurated"),
                bag.reference("language"));
    }

    @Override
    public KnownClass knownClass() {
        return KnownClass.CHANNEL;
    }

    @Override
    public List<ReferenceProperty> references() {
        return ReferenceProperty.present(
                ReferenceProperty.of("language", KnownClass.LANGUAGE, language));
    }
}
