package com.flagship.content_graph.event;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * A single decoded content directory event.
 *
 * {@code classId} is only carried by {@link EventKind#EntityCreated};
 * {@code extrinsic} is absent when the indexer could not attach the call.
 */
public record LedgerEvent(
        EventKind kind,
        long blockNumber,
        long entityId,
        Integer classId,
        Extrinsic extrinsic
) {

    /** Position of the property value map in {@code add_schema_support_to_entity}. */
    public static final int SCHEMA_SUPPORT_PROPERTY_VALUES_ARG = 4;

    /** Position of the property value map in {@code update_entity_property_values}. */
    public static final int UPDATE_PROPERTY_VALUES_ARG = 3;

    public static LedgerEvent entityCreated(long blockNumber, long entityId, int classId) {
        return new LedgerEvent(EventKind.EntityCreated, blockNumber, entityId, classId, null);
    }

    public static LedgerEvent schemaSupportAdded(long blockNumber, long entityId, Extrinsic extrinsic) {
        return new LedgerEvent(EventKind.EntitySchemaSupportAdded, blockNumber, entityId, null, extrinsic);
    }

    public static LedgerEvent propertyValuesUpdated(long blockNumber, long entityId, Extrinsic extrinsic) {
        return new LedgerEvent(EventKind.EntityPropertyValuesUpdated, blockNumber, entityId, null, extrinsic);
    }

    public static LedgerEvent entityRemoved(long blockNumber, long entityId) {
        return new LedgerEvent(EventKind.EntityRemoved, blockNumber, entityId, null, null);
    }

    /** Entity ids are stored in their decimal string form. */
    public String entityKey() {
        return Long.toString(entityId);
    }

    public boolean isPartOfTransaction() {
        return extrinsic != null && extrinsic.isTransaction();
    }

    public Optional<JsonNode> propertyValues(int argIndex) {
        return extrinsic == null ? Optional.empty() : extrinsic.arg(argIndex);
    }
}
