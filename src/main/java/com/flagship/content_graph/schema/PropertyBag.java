package com.flagship.content_graph.schema;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Named, typed property values decoded for one known class.
 * Absent properties have no entry; getters return null for them.
 */
public final class PropertyBag {

    private final KnownClass knownClass;
    private final Map<String, Object> values;

    PropertyBag(KnownClass knownClass, Map<String, Object> values) {
        this.knownClass = knownClass;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public KnownClass knownClass() {
        return knownClass;
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public Set<String> names() {
        return values.keySet();
    }

    public String text(String name) {
        return get(name, String.class);
    }

    public Boolean bool(String name) {
        return get(name, Boolean.class);
    }

    public Integer uint16(String name) {
        return get(name, Integer.class);
    }

    public Long uint32(String name) {
        return get(name, Long.class);
    }

    public BigInteger uint64(String name) {
        return get(name, BigInteger.class);
    }

    public Long int64(String name) {
        return get(name, Long.class);
    }

    public Reference reference(String name) {
        return get(name, Reference.class);
    }

    private <T> T get(String name, Class<T> type) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw new IllegalStateException(String.format(
                    "Property %s.%s holds %s, not %s",
                    knownClass.className(), name, value.getClass().getSimpleName(), type.getSimpleName()));
        }
        return type.cast(value);
    }

    @Override
    public String toString() {
        return knownClass.className() + values;
    }
}
