package com.flagship.content_graph.schema.properties;

import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.Reference;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A present Reference-valued property together with the class its target
 * must belong to.
 */
public record ReferenceProperty(String property, KnownClass targetClass, Reference reference) {

    public ReferenceProperty {
        Objects.requireNonNull(property, "property");
        Objects.requireNonNull(targetClass, "targetClass");
        Objects.requireNonNull(reference, "reference");
    }

    /**
     * Returns null when the reference is absent, to be filtered by {@link #present}.
     */
    static ReferenceProperty of(String property, KnownClass targetClass, Reference reference) {
        return reference == null ? null : new ReferenceProperty(property, targetClass, reference);
    }

    static List<ReferenceProperty> present(ReferenceProperty... candidates) {
        return Arrays.stream(candidates)
                .filter(Objects::nonNull)
                .toList();
    }
}
