package com.flagship.content_graph.handler;

import com.flagship.content_graph.content.TypedEntity;
import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.Reference;
import com.flagship.content_graph.schema.properties.EntityProperties;
import com.flagship.content_graph.store.EntityStore;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Lifecycle handler skeleton. Subclasses only map their property record
 * onto their row type in {@link #apply}.
 *
 * @param <E> typed row
 * @param <P> property record of the class
 */
@Slf4j
public abstract class AbstractEntityHandler<E extends TypedEntity, P extends EntityProperties>
        implements EntityLifecycleHandler {

    private final EntityStore store;
    private final KnownClass knownClass;
    private final Class<E> rowType;
    private final Class<P> propertiesType;
    private final Supplier<E> rowFactory;

    protected AbstractEntityHandler(EntityStore store, KnownClass knownClass, Class<E> rowType,
                                    Class<P> propertiesType, Supplier<E> rowFactory) {
        if (!knownClass.rowType().equals(rowType)) {
            throw new IllegalArgumentException(
                    "Row type " + rowType.getSimpleName() + " does not belong to " + knownClass);
        }
        this.store = store;
        this.knownClass = knownClass;
        this.rowType = rowType;
        this.propertiesType = propertiesType;
        this.rowFactory = rowFactory;
    }

    @Override
    public KnownClass knownClass() {
        return knownClass;
    }

    @Override
    public void create(BlockContext block, String entityId, EntityProperties properties) {
        P typed = cast(properties);
        Optional<E> existing = store.find(rowType, entityId);
        E row = existing.orElseGet(() -> {
            E fresh = rowFactory.get();
            fresh.setId(entityId);
            return fresh;
        });
        apply(row, typed);
        row.touch(block.height());
        store.save(row);
        if (existing.isPresent()) {
            log.debug("Schema re-attached to {} {} at block {}, kept properties it did not carry",
                    knownClass.className(), entityId, block.height());
        } else {
            log.debug("Created {} {} at block {}", knownClass.className(), entityId, block.height());
        }
    }

    @Override
    public boolean update(BlockContext block, String entityId, EntityProperties properties) {
        P typed = cast(properties);
        Optional<E> existing = store.find(rowType, entityId);
        if (existing.isEmpty()) {
            log.warn("No {} row for entity {}, update at block {} not applied",
                    knownClass.className(), entityId, block.height());
            return false;
        }
        E row = existing.get();
        if (block.height() < row.getVersion()) {
            log.warn("{} {} is at version {}, update from older block {} keeps the version",
                    knownClass.className(), entityId, row.getVersion(), block.height());
        }
        apply(row, typed);
        row.touch(block.height());
        store.save(row);
        log.debug("Updated {} {} at block {}", knownClass.className(), entityId, block.height());
        return true;
    }

    @Override
    public boolean remove(String entityId) {
        Optional<E> existing = store.find(rowType, entityId);
        existing.ifPresent(store::remove);
        log.debug("Removed {} {} (row present: {})", knownClass.className(), entityId, existing.isPresent());
        return existing.isPresent();
    }

    /**
     * Copies every present property onto the row. Absent (null) properties
     * leave the row's value untouched.
     */
    protected abstract void apply(E row, P properties);

    protected static <V> void assign(V value, Consumer<V> setter) {
        if (value != null) {
            setter.accept(value);
        }
    }

    /**
     * References are stored as the id of their target.
     */
    protected static void assignReference(Reference reference, Consumer<String> setter) {
        if (reference != null) {
            setter.accept(reference.targetEntityId());
        }
    }

    private P cast(EntityProperties properties) {
        if (!propertiesType.isInstance(properties)) {
            throw new IllegalArgumentException(String.format("%s handler cannot apply %s",
                    knownClass.className(), properties == null ? "null" : properties.getClass().getSimpleName()));
        }
        return propertiesType.cast(properties);
    }
}
