package com.flagship.content_graph.materializer;

import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.properties.EntityProperties;

import java.util.Optional;

/**
 * An entity introduced by a ledger transaction, with its class resolved from
 * the transaction's own creation record.
 *
 * @param knownClass null when the class is not a known class
 * @param properties null when the class is unknown or no schema was attached
 */
public record BatchEntity(
        int position,
        String entityId,
        int classId,
        KnownClass knownClass,
        EntityProperties properties
) {

    public Optional<KnownClass> known() {
        return Optional.ofNullable(knownClass);
    }

    public boolean hasProperties() {
        return properties != null;
    }
}
