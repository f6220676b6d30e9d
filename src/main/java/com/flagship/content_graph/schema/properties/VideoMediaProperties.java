package com.flagship.content_graph.schema.properties;

import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.PropertyBag;
import com.flagship.content_graph.schema.Reference;

import java.math.BigInteger;
import java.util.List;

public record VideoMediaProperties(
        Reference encoding,
        Integer pixelWidth,
        Integer pixelHeight,
        BigInteger size,
        Reference location
) implements EntityProperties {

    public static VideoMediaProperties from(PropertyBag bag) {
        return new VideoMediaProperties(
                bag.reference("encoding"),
                bag.uint16("pixelWidth"),
                bag.uint16("pixelHeight"),
                bag.uint64("size"),
                bag.reference("location"));
    }

    @Override
    public KnownClass knownClass() {
        return KnownClass.VIDEO_MEDIA;
    }

    @Override
    public List<ReferenceProperty> references() {
        return ReferenceProperty.present(
                ReferenceProperty.of("encoding", KnownClass.VIDEO_MEDIA_ENCODING, encoding),
                ReferenceProperty.of("location", KnownClass.MEDIA_LOCATION, location));
    }
}
