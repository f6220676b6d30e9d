package com.flagship.content_graph.materializer;

import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.Reference;
import com.flagship.content_graph.schema.properties.EntityProperties;
import com.flagship.content_graph.schema.properties.ReferenceProperty;
import com.flagship.content_graph.store.EntityStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Decides whether decoded entities can be written without leaving a
 * dangling reference in the store.
 *
 * Two modes:
 * <ul>
 *   <li>Batch: a reference to an existing entity must resolve to a persisted
 *       row of the target class; a reference to an entity of the same
 *       transaction must resolve to an entity of the target class introduced
 *       by that transaction. The scan stops at the first unresolved
 *       reference and the whole transaction is ignored.</li>
 *   <li>Single entity: every reference must resolve to a persisted row.
 *       Same-transaction references cannot resolve outside a transaction.</li>
 * </ul>
 * Neither mode writes to the store.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReferenceIntegrityValidator {

    private final EntityStore store;

    public BatchValidation validate(BatchContext batch) {
        for (BatchEntity entity : batch.entities()) {
            if (!entity.hasProperties()) {
                continue;
            }
            for (ReferenceProperty property : entity.properties().references()) {
                if (!resolvesInBatch(batch, property)) {
                    UnresolvedReference unresolved =
                            new UnresolvedReference(entity.knownClass(), entity.entityId(), property);
                    log.debug("Transaction at block {} has unresolved reference {}",
                            batch.blockNumber(), unresolved.describe());
                    return BatchValidation.ignored(unresolved);
                }
            }
        }
        return BatchValidation.applicable();
    }

    /**
     * Checks the references of a standalone event against the store only.
     *
     * @return the first unresolved reference, empty if all resolve
     */
    public Optional<UnresolvedReference> findUnresolved(String entityId, EntityProperties properties) {
        for (ReferenceProperty property : properties.references()) {
            Reference reference = property.reference();
            if (!reference.existing() || !isPersisted(property.targetClass(), reference.targetEntityId())) {
                return Optional.of(new UnresolvedReference(properties.knownClass(), entityId, property));
            }
        }
        return Optional.empty();
    }

    private boolean resolvesInBatch(BatchContext batch, ReferenceProperty property) {
        Reference reference = property.reference();
        return reference.existing()
                ? isPersisted(property.targetClass(), reference.targetEntityId())
                : batch.introduces(property.targetClass(), reference.targetEntityId());
    }

    private boolean isPersisted(KnownClass targetClass, String targetEntityId) {
        return store.exists(targetClass.rowType(), targetEntityId);
    }
}
