package com.flagship.content_graph.materializer;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.content_graph.event.CreateEntityOperation;
import com.flagship.content_graph.event.LedgerEvent;
import com.flagship.content_graph.event.LedgerTransaction;
import com.flagship.content_graph.exception.BatchOrderingException;
import com.flagship.content_graph.exception.MissingExtrinsicDataException;
import com.flagship.content_graph.exception.UnknownClassException;
import com.flagship.content_graph.handler.BlockContext;
import com.flagship.content_graph.handler.HandlerRegistry;
import com.flagship.content_graph.observability.IngestionContext;
import com.flagship.content_graph.observability.MaterializerMetrics;
import com.flagship.content_graph.schema.ClassRegistry;
import com.flagship.content_graph.schema.ClassResolution;
import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.PropertyDecoder;
import com.flagship.content_graph.schema.properties.EntityProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Routes content directory events to the lifecycle handler of their class.
 *
 * Messages must be dispatched one at a time, in ledger emission order. Each
 * dispatch runs in its own store transaction and settles completely before
 * it returns.
 *
 * Outcomes:
 * - APPLIED: the store was mutated
 * - DROPPED: recoverable rejection (dangling reference, unregistered class
 *   during schema attachment, missing typed row on update); store unchanged
 * - SKIPPED: event belongs to a ledger transaction, materialized through
 *   {@link #dispatchTransaction} instead
 *
 * Fatal conditions throw a {@code FatalIngestionException}; store failures
 * propagate as thrown by the store. Both roll the store transaction back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntityEventDispatcher {

    private static final String TRANSACTION_KIND = "Transaction";

    private final ClassRegistry classRegistry;
    private final PropertyDecoder propertyDecoder;
    private final ReferenceIntegrityValidator validator;
    private final HandlerRegistry handlers;
    private final EntityIndexService entityIndex;
    private final MaterializerMetrics metrics;

    @Transactional
    public DispatchOutcome dispatch(LedgerEvent event) {
        IngestionContext.enter(event.blockNumber(), event.entityKey());
        try {
            return settle(event.kind().name(), () -> route(event));
        } finally {
            IngestionContext.clear();
        }
    }

    /**
     * Materializes all entities of a ledger transaction, or none of them.
     */
    @Transactional
    public DispatchOutcome dispatchTransaction(LedgerTransaction transaction) {
        IngestionContext.enter(transaction.blockNumber(), null);
        try {
            return settle(TRANSACTION_KIND, () -> materializeTransaction(transaction));
        } finally {
            IngestionContext.clear();
        }
    }

    private DispatchOutcome settle(String kind, Supplier<DispatchOutcome> dispatch) {
        try {
            DispatchOutcome outcome = metrics.timeDispatch(dispatch);
            metrics.recordEvent(kind, outcome);
            if (outcome.isDropped()) {
                log.info("Dropped {}: {}", kind, outcome.reason());
            } else if (outcome.isSkipped()) {
                log.debug("Skipped {}: {}", kind, outcome.reason());
            }
            return outcome;
        } catch (RuntimeException e) {
            metrics.recordFatal(kind, e);
            log.error("Failed to materialize {}: {}", kind, e.getMessage(), e);
            throw e;
        }
    }

    private DispatchOutcome route(LedgerEvent event) {
        return switch (event.kind()) {
            case EntityCreated -> onEntityCreated(event);
            case EntitySchemaSupportAdded -> onSchemaSupportAdded(event);
            case EntityPropertyValuesUpdated -> onPropertyValuesUpdated(event);
            case EntityRemoved -> onEntityRemoved(event);
            case Transaction -> throw new IllegalArgumentException(
                    "Ledger transactions are dispatched through dispatchTransaction");
        };
    }

    private DispatchOutcome onEntityCreated(LedgerEvent event) {
        if (event.isPartOfTransaction()) {
            return DispatchOutcome.skipped("Entity created inside a ledger transaction");
        }
        if (event.classId() == null) {
            throw new IllegalArgumentException("EntityCreated event without class id: entity " + event.entityKey());
        }

        BlockContext block = entityIndex.ensureBlock(event.blockNumber());
        entityIndex.index(event.entityKey(), event.classId(), block);
        entityIndex.advanceNextEntityId(event.entityId() + 1);
        return DispatchOutcome.applied();
    }

    private DispatchOutcome onSchemaSupportAdded(LedgerEvent event) {
        if (event.isPartOfTransaction()) {
            return DispatchOutcome.skipped("Schema support added inside a ledger transaction");
        }
        String entityId = event.entityKey();

        ClassResolution resolution = classRegistry.resolveClass(entityId);
        if (!resolution.isRegistered()) {
            return DispatchOutcome.dropped("Class of entity " + entityId + " is not registered");
        }
        KnownClass knownClass = requireKnownClass(resolution);

        EntityProperties properties = decode(event, knownClass, LedgerEvent.SCHEMA_SUPPORT_PROPERTY_VALUES_ARG);
        Optional<UnresolvedReference> unresolved = validator.findUnresolved(entityId, properties);
        if (unresolved.isPresent()) {
            return DispatchOutcome.dropped("Unresolved reference " + unresolved.get().describe());
        }

        BlockContext block = entityIndex.ensureBlock(event.blockNumber());
        handlers.handlerFor(knownClass).create(block, entityId, properties);
        return DispatchOutcome.applied();
    }

    private DispatchOutcome onPropertyValuesUpdated(LedgerEvent event) {
        if (event.isPartOfTransaction()) {
            return DispatchOutcome.skipped("Property values updated inside a ledger transaction");
        }
        if (event.extrinsic() == null) {
            throw new MissingExtrinsicDataException(event.kind().name(), event.blockNumber(), event.entityKey());
        }
        String entityId = event.entityKey();

        ClassResolution resolution = classRegistry.resolveClass(entityId);
        if (!resolution.isRegistered()) {
            throw UnknownClassException.forEntity(entityId);
        }
        KnownClass knownClass = requireKnownClass(resolution);

        EntityProperties properties = decode(event, knownClass, LedgerEvent.UPDATE_PROPERTY_VALUES_ARG);
        Optional<UnresolvedReference> unresolved = validator.findUnresolved(entityId, properties);
        if (unresolved.isPresent()) {
            return DispatchOutcome.dropped("Unresolved reference " + unresolved.get().describe());
        }

        BlockContext block = new BlockContext(event.blockNumber());
        if (!handlers.handlerFor(knownClass).update(block, entityId, properties)) {
            return DispatchOutcome.dropped("No " + knownClass.className() + " row for entity " + entityId);
        }
        entityIndex.ensureBlock(block.height());
        return DispatchOutcome.applied();
    }

    private DispatchOutcome onEntityRemoved(LedgerEvent event) {
        String entityId = event.entityKey();

        ClassResolution resolution = classRegistry.resolveClass(entityId);
        if (!resolution.isIndexed()) {
            throw UnknownClassException.forEntity(entityId);
        }
        if (!resolution.isRegistered()) {
            // Entity of a class the materializer never types: only the index row exists.
            entityIndex.removeIndex(entityId);
            log.debug("Removed untyped entity {} of class {}", entityId, resolution.classId());
            return DispatchOutcome.applied();
        }
        KnownClass knownClass = requireKnownClass(resolution);

        handlers.handlerFor(knownClass).remove(entityId);
        entityIndex.removeIndex(entityId);
        return DispatchOutcome.applied();
    }

    private DispatchOutcome materializeTransaction(LedgerTransaction transaction) {
        if (transaction.operations().isEmpty()) {
            return DispatchOutcome.skipped("Ledger transaction without entity creations");
        }
        checkOrdering(transaction);

        BatchContext batch = buildBatch(transaction);
        BatchValidation validation = validator.validate(batch);
        if (!validation.isApplicable()) {
            metrics.recordTransactionIgnored();
            String unresolved = validation.firstUnresolved()
                    .map(UnresolvedReference::describe)
                    .orElse("unknown");
            return DispatchOutcome.dropped(String.format(
                    "Ledger transaction with %d entities ignored, unresolved reference %s",
                    batch.entities().size(), unresolved));
        }

        BlockContext block = entityIndex.ensureBlock(transaction.blockNumber());
        for (BatchEntity entity : batch.entities()) {
            entityIndex.index(entity.entityId(), entity.classId(), block);
            if (entity.hasProperties()) {
                handlers.handlerFor(entity.knownClass()).create(block, entity.entityId(), entity.properties());
            }
        }
        List<CreateEntityOperation> operations = transaction.operations();
        entityIndex.advanceNextEntityId(operations.get(operations.size() - 1).entityId() + 1);

        metrics.recordTransactionApplied();
        log.info("Materialized ledger transaction at block {} with {} entities",
                transaction.blockNumber(), batch.entities().size());
        return DispatchOutcome.applied();
    }

    /**
     * Entity ids must increase with batch position, starting at or above the
     * next entity id already recorded.
     */
    private void checkOrdering(LedgerTransaction transaction) {
        List<CreateEntityOperation> operations = transaction.operations();
        Optional<Long> nextEntityId = entityIndex.nextEntityId();
        long firstId = operations.get(0).entityId();
        if (nextEntityId.isPresent() && firstId < nextEntityId.get()) {
            throw new BatchOrderingException(String.format(
                    "Ledger transaction at block %d starts at entity %d, below next entity id %d",
                    transaction.blockNumber(), firstId, nextEntityId.get()));
        }
        for (int i = 1; i < operations.size(); i++) {
            long previous = operations.get(i - 1).entityId();
            long current = operations.get(i).entityId();
            if (current <= previous) {
                throw new BatchOrderingException(String.format(
                        "Ledger transaction at block %d: entity %d at position %d does not follow entity %d",
                        transaction.blockNumber(), current, i, previous));
            }
        }
    }

    private BatchContext buildBatch(LedgerTransaction transaction) {
        List<BatchEntity> entities = new ArrayList<>();
        List<CreateEntityOperation> operations = transaction.operations();
        for (int position = 0; position < operations.size(); position++) {
            CreateEntityOperation operation = operations.get(position);
            KnownClass knownClass = classRegistry.classOf(operation.classId()).knownClass().orElse(null);

            EntityProperties properties = null;
            JsonNode rawValues = operation.propertyValues();
            if (knownClass != null && rawValues != null && !rawValues.isNull()) {
                properties = propertyDecoder.decode(knownClass, classRegistry.propertyLayout(knownClass), rawValues);
            }
            entities.add(new BatchEntity(position, operation.entityKey(), operation.classId(), knownClass, properties));
        }
        return BatchContext.of(transaction.blockNumber(), entities);
    }

    private EntityProperties decode(LedgerEvent event, KnownClass knownClass, int argIndex) {
        JsonNode rawValues = event.propertyValues(argIndex)
                .orElseThrow(() -> new MissingExtrinsicDataException(
                        event.kind().name(), event.blockNumber(), event.entityKey()));
        return propertyDecoder.decode(knownClass, classRegistry.propertyLayout(knownClass), rawValues);
    }

    private KnownClass requireKnownClass(ClassResolution resolution) {
        return resolution.knownClass()
                .orElseThrow(() -> UnknownClassException.forClassName(resolution.className()));
    }
}
