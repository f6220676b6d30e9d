package com.flagship.content_graph.materializer;

import com.flagship.content_graph.schema.KnownClass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The entities one ledger transaction introduces, grouped by known class.
 * Only entities that acquire a typed row are grouped; they are the valid
 * targets of same-transaction references.
 *
 * Immutable once built. Scoped to a single validation and apply pass.
 */
public final class BatchContext {

    private final long blockNumber;
    private final List<BatchEntity> entities;
    private final Map<KnownClass, List<BatchEntity>> byClass;

    private BatchContext(long blockNumber, List<BatchEntity> entities,
                         Map<KnownClass, List<BatchEntity>> byClass) {
        this.blockNumber = blockNumber;
        this.entities = entities;
        this.byClass = byClass;
    }

    public static BatchContext of(long blockNumber, List<BatchEntity> entities) {
        Map<KnownClass, List<BatchEntity>> grouped = new EnumMap<>(KnownClass.class);
        for (BatchEntity entity : entities) {
            if (!entity.hasProperties()) {
                // Indexed only, never gets a typed row to point at.
                continue;
            }
            entity.known().ifPresent(knownClass ->
                    grouped.computeIfAbsent(knownClass, k -> new ArrayList<>()).add(entity));
        }
        grouped.replaceAll((k, list) -> Collections.unmodifiableList(list));
        return new BatchContext(blockNumber, List.copyOf(entities), Collections.unmodifiableMap(grouped));
    }

    public long blockNumber() {
        return blockNumber;
    }

    /**
     * All entities of the transaction, in batch order.
     */
    public List<BatchEntity> entities() {
        return entities;
    }

    /**
     * Entities of one known class that carry property values, in batch order.
     */
    public List<BatchEntity> entitiesOf(KnownClass knownClass) {
        return byClass.getOrDefault(knownClass, List.of());
    }

    /**
     * True if the transaction introduces an entity of the class with the id.
     */
    public boolean introduces(KnownClass knownClass, String entityId) {
        return entitiesOf(knownClass).stream()
                .anyMatch(entity -> entity.entityId().equals(entityId));
    }
}
