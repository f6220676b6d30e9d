package com.flagship.content_graph.handler;

import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.properties.EntityProperties;

/**
 * Create/update/remove routines for the typed rows of one known class.
 *
 * Handlers own the typed rows only. The {@code ClassEntity} index row is
 * written by the dispatcher. Reference integrity must be established before
 * {@link #create} or {@link #update} is called.
 */
public interface EntityLifecycleHandler {

    KnownClass knownClass();

    /**
     * Materializes a typed row with {@code version} set to the block height.
     * If the row already exists, the present properties are applied onto it
     * and absent ones keep their values; {@code version} never decreases.
     *
     * @throws IllegalArgumentException if the properties belong to another class
     */
    void create(BlockContext block, String entityId, EntityProperties properties);

    /**
     * Applies the present properties to an existing typed row.
     *
     * @return false if no typed row exists for the id; nothing is written then
     */
    boolean update(BlockContext block, String entityId, EntityProperties properties);

    /**
     * Deletes the typed row.
     *
     * @return false if no typed row existed
     */
    boolean remove(String entityId);
}
