package com.flagship.content_graph.store;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * JPA implementation of the graph store.
 *
 * Runs inside the transaction opened by the dispatcher, so rows written
 * earlier in the same event or batch are visible to later lookups.
 * {@code @Repository} translates persistence exceptions into Spring's
 * {@code DataAccessException} hierarchy.
 */
@Repository
@Slf4j
public class JpaEntityStore implements EntityStore {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @Transactional(readOnly = true)
    public <T> Optional<T> find(Class<T> type, Object id) {
        return Optional.ofNullable(entityManager.find(type, id));
    }

    @Override
    @Transactional
    public <T> T save(T row) {
        if (entityManager.contains(row)) {
            return row;
        }
        T managed = entityManager.merge(row);
        log.trace("Saved {}", managed);
        return managed;
    }

    @Override
    @Transactional
    public void remove(Object row) {
        Object managed = entityManager.contains(row) ? row : entityManager.merge(row);
        entityManager.remove(managed);
        log.trace("Removed {}", managed);
    }
}
