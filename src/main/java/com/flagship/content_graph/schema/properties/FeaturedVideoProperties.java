package com.flagship.content_graph.schema.properties;

import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.PropertyBag;
import com.flagship.content_graph.schema.Reference;

import java.util.List;

public record FeaturedVideoProperties(Reference video) implements EntityProperties {

    public static FeaturedVideoProperties from(PropertyBag bag) {
        return new FeaturedVideoProperties(bag.reference("video"));
    }

    @Override
    public KnownClass knownClass() {
        return KnownClass.FEATURED_VIDEO;
    }

    @Override
    public List<ReferenceProperty> references() {
        return ReferenceProperty.present(
                ReferenceProperty.of("video", KnownClass.VIDEO, video));
    }
}
