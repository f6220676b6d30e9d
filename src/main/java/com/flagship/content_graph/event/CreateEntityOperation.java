package com.flagship.content_graph.event;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One entity introduced by a ledger transaction, with the property values
 * its schema support was added with. {@code propertyValues} is null when the
 * transaction created the entity without attaching a schema.
 */
public record CreateEntityOperation(long entityId, int classId, JsonNode propertyValues) {

    public String entityKey() {
        return Long.toString(entityId);
    }
}
