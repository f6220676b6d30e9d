package com.flagship.content_graph.schema.properties;

import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.PropertyBag;
import com.flagship.content_graph.schema.Reference;

import java.util.List;

public record VideoProperties(
        Reference channel,
        Reference category,
        String title,
        String description,
        Long duration,
        Long skippableIntroDuration,
        String thumbnailUrl,
        Reference language,
        Reference media,
        Boolean hasMarketing,
        Long publishedBeforeJoystream,
        Boolean isPublic,
        Boolean isCurated,
        Boolean isExplicit,
        Reference license
) implements EntityProperties {

    public static VideoProperties from(PropertyBag bag) {
        return new VideoProperties(
                bag.reference("channel"),
                bag.reference("category"),
                bag.text("title"),
                bag.text("description"),
                bag.uint32("duration"),
                bag.uint32("skippableIntroDuration"),
                bag.text("thumbnailUrl"),
                bag.reference("language"),
                bag.reference("media"),
                bag.bool("hasMarketing"),
                bag.int64("publishedBeforeJoystream"),
                bag.bool("isPublic"),
                bag.bool("isCurated"),
                bag.bool("isExplicit"),
                bag.reference("license"));
    }

    @Override
    public KnownClass knownClass() {
        return KnownClass.VIDEO;
    }

    @Override
    public List<ReferenceProperty> references() {
        return ReferenceProperty.present(
                ReferenceProperty.of("channel", KnownClass.CHANNEL, channel),
                ReferenceProperty.of("category", KnownClass.CATEGORY, category),
                ReferenceProperty.of("language", KnownClass.LANGUAGE, language),
                ReferenceProperty.of("media", KnownClass.VIDEO_MEDIA, media),
                ReferenceProperty.of("license", KnownClass.LICENSE, license));
    }
}
