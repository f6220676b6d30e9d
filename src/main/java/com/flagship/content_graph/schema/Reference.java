package com.flagship.content_graph.schema;

import java.util.Objects;

/**
 * A relation-typed property value.
 *
 * @param targetEntityId id of the referenced entity
 * @param existing true when the target must already be persisted; false when
 *                 it is introduced by the same ledger transaction
 */
public record Reference(String targetEntityId, boolean existing) {

    public Reference {
        Objects.requireNonNull(targetEntityId, "targetEntityId");
    }

    public static Reference existing(String targetEntityId) {
        return new Reference(targetEntityId, true);
    }

    public static Reference batchLocal(String targetEntityId) {
        return new Reference(targetEntityId, false);
    }
}
