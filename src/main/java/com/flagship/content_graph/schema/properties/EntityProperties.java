package com.flagship.content_graph.schema.properties;

import com.flagship.content_graph.schema.KnownClass;

import java.util.List;

/**
 * Statically typed property set of one known class.
 *
 * Every field is nullable: null means the event did not carry the property.
 */
public interface EntityProperties {

    KnownClass knownClass();

    /**
     * The Reference-valued properties that are present, in layout order.
     */
    List<ReferenceProperty> references();
}
