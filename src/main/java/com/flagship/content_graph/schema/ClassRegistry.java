package com.flagship.content_graph.schema;

import java.util.List;

/**
 * Maps entities and class ids to content directory classes.
 */
public interface ClassRegistry {

    /**
     * Resolves the class of a persisted entity through its index row.
     */
    ClassResolution resolveClass(String entityId);

    /**
     * Resolves a class id directly, for entities that are not persisted yet.
     */
    ClassResolution classOf(int classId);

    /**
     * Ordered property layout of a known class.
     */
    List<PropertyDefinition> propertyLayout(KnownClass knownClass);
}
