package com.flagship.content_graph.event;

/**
 * Kinds of content directory ledger messages the materializer consumes.
 */
public enum EventKind {
    EntityCreated,
    EntitySchemaSupportAdded,
    EntityPropertyValuesUpdated,
    EntityRemoved,
    Transaction
}
