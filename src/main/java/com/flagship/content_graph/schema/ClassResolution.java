package com.flagship.content_graph.schema;

import java.util.Optional;

/**
 * Outcome of resolving the class of an entity.
 *
 * @param classId   ledger class id, null when no entity with the id is indexed
 * @param className registered class name, null when the class id is not registered
 */
public record ClassResolution(Integer classId, String className) {

    private static final ClassResolution UNINDEXED = new ClassResolution(null, null);

    public static ClassResolution unindexed() {
        return UNINDEXED;
    }

    public static ClassResolution unregistered(int classId) {
        return new ClassResolution(classId, null);
    }

    public static ClassResolution registered(int classId, String className) {
        return new ClassResolution(classId, className);
    }

    /**
     * True if an index row for the entity exists.
     */
    public boolean isIndexed() {
        return classId != null;
    }

    /**
     * True if the entity's class id maps to a class name.
     */
    public boolean isRegistered() {
        return className != null;
    }

    /**
     * The known class, empty when unregistered or outside the known-class enumeration.
     */
    public Optional<KnownClass> knownClass() {
        return KnownClass.fromClassName(className);
    }
}
