package com.flagship.content_graph.store;

import java.util.Optional;

/**
 * Read/write primitives of the materialized graph store.
 *
 * Implementations propagate store failures as unchecked exceptions
 * (Spring's {@code DataAccessException} hierarchy); callers never retry.
 */
public interface EntityStore {

    /**
     * Finds a row of the given type by primary key.
     */
    <T> Optional<T> find(Class<T> type, Object id);

    /**
     * Returns true if a row of the given type with the given key is persisted.
     */
    default boolean exists(Class<?> type, Object id) {
        return find(type, id).isPresent();
    }

    /**
     * Inserts or updates a row.
     *
     * @return the stored row
     */
    <T> T save(T row);

    /**
     * Deletes a row previously returned by {@link #find} or {@link #save}.
     */
    void remove(Object row);
}
