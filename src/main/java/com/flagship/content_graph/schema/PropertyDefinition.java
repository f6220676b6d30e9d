package com.flagship.content_graph.schema;

import java.util.Objects;

/**
 * One slot of a class property layout. {@code targetClass} is set only for
 * {@link PropertyType#REFERENCE} slots.
 */
public record PropertyDefinition(String name, PropertyType type, KnownClass targetClass) {

    public PropertyDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if ((type == PropertyType.REFERENCE) != (targetClass != null)) {
            throw new IllegalArgumentException("Reference slots, and only they, declare a target class: " + name);
        }
    }

    public static PropertyDefinition text(String name) {
        return new PropertyDefinition(name, PropertyType.TEXT, null);
    }

    public static PropertyDefinition bool(String name) {
        return new PropertyDefinition(name, PropertyType.BOOL, null);
    }

    public static PropertyDefinition uint16(String name) {
        return new PropertyDefinition(name, PropertyType.UINT16, null);
    }

    public static PropertyDefinition uint32(String name) {
        return new PropertyDefinition(name, PropertyType.UINT32, null);
    }

    public static PropertyDefinition uint64(String name) {
        return new PropertyDefinition(name, PropertyType.UINT64, null);
    }

    public static PropertyDefinition int64(String name) {
        return new PropertyDefinition(name, PropertyType.INT64, null);
    }

    public static PropertyDefinition reference(String name, KnownClass targetClass) {
        return new PropertyDefinition(name, PropertyType.REFERENCE, Objects.requireNonNull(targetClass));
    }
}
