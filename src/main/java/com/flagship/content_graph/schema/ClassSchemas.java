package com.flagship.content_graph.schema;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.flagship.content_graph.schema.PropertyDefinition.bool;
import static com.flagship.content_graph.schema.PropertyDefinition.int64;
import static com.flagship.content_graph.schema.PropertyDefinition.reference;
import static com.flagship.content_graph.schema.PropertyDefinition.text;
import static com.flagship.content_graph.schema.PropertyDefinition.uint16;
import static com.flagship.content_graph.schema.PropertyDefinition.uint32;
import static com.flagship.content_graph.schema.PropertyDefinition.uint64;

/**
 * Property layouts of the known classes, in property id order.
 */
public final class ClassSchemas {

    private static final Map<KnownClass, List<PropertyDefinition>> LAYOUTS = new EnumMap<>(KnownClass.class);

    static {
        LAYOUTS.put(KnownClass.CHANNEL, List.of(
                text("handle"),
                text("description"),
                text("coverPhotoUrl"),
                text("avatarPhotoUrl"),
                bool("isPublic"),
                bool("isCurated"),
                reference("language", KnownClass.LANGUAGE)));
        LAYOUTS.put(KnownClass.CATEGORY, List.of(
                text("name"),
                text("description")));
        LAYOUTS.put(KnownClass.KNOWN_LICENSE, List.of(
                text("code"),
                text("name"),
                text("description"),
                text("url")));
        LAYOUTS.put(KnownClass.USER_DEFINED_LICENSE, List.of(
                text("content")));
        LAYOUTS.put(KnownClass.JOYSTREAM_MEDIA_LOCATION, List.of(
                text("dataObjectId")));
        LAYOUTS.put(KnownClass.HTTP_MEDIA_LOCATION, List.of(
                text("url"),
                uint16("port")));
        LAYOUTS.put(KnownClass.VIDEO_MEDIA_ENCODING, List.of(
                text("name")));
        LAYOUTS.put(KnownClass.VIDEO_MEDIA, List.of(
                reference("encoding", KnownClass.VIDEO_MEDIA_ENCODING),
                uint16("pixelWidth"),
                uint16("pixelHeight"),
                uint64("size"),
                reference("location", KnownClass.MEDIA_LOCATION)));
        LAYOUTS.put(KnownClass.VIDEO, List.of(
                reference("channel", KnownClass.CHANNEL),
                reference("category", KnownClass.CATEGORY),
                text("title"),
                text("description"),
                uint32("duration"),
                uint32("skippableIntroDuration"),
                text("thumbnailUrl"),
                reference("language", KnownClass.LANGUAGE),
                reference("media", KnownClass.VIDEO_MEDIA),
                bool("hasMarketing"),
                int64("publishedBeforeJoystream"),
                bool("isPublic"),
                bool("isCurated"),
                bool("isExplicit"),
                reference("license", KnownClass.LICENSE)));
        LAYOUTS.put(KnownClass.LANGUAGE, List.of(
                text("name"),
                text("code")));
        LAYOUTS.put(KnownClass.LICENSE, List.of(
                reference("knownLicense", KnownClass.KNOWN_LICENSE),
                reference("userDefinedLicense", KnownClass.USER_DEFINED_LICENSE)));
        LAYOUTS.put(KnownClass.MEDIA_LOCATION, List.of(
                reference("httpMediaLocation", KnownClass.HTTP_MEDIA_LOCATION),
                reference("joystreamMediaLocation", KnownClass.JOYSTREAM_MEDIA_LOCATION)));
        LAYOUTS.put(KnownClass.FEATURED_VIDEO, List.of(
                reference("video", KnownClass.VIDEO)));
    }

    private ClassSchemas() {
    }

    public static List<PropertyDefinition> layoutOf(KnownClass knownClass) {
        List<PropertyDefinition> layout = LAYOUTS.get(knownClass);
        if (layout == null) {
            throw new IllegalStateException("No property layout for " + knownClass);
        }
        return layout;
    }

    static Map<KnownClass, List<PropertyDefinition>> all() {
        return Collections.unmodifiableMap(LAYOUTS);
    }
}
