package com.flagship.content_graph.materializer;

import com.flagship.content_graph.handler.BlockContext;
import com.flagship.content_graph.store.BlockEntity;
import com.flagship.content_graph.store.ClassEntity;
import com.flagship.content_graph.store.EntityStore;
import com.flagship.content_graph.store.NextEntityIdEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Maintains the rows the dispatcher owns: the {@code ClassEntity} index,
 * the blocks mutations happened in, and the next entity id counter.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntityIndexService {

    private final EntityStore store;

    /**
     * Returns the block context, creating the block row on first use.
     */
    public BlockContext ensureBlock(long height) {
        if (!store.exists(BlockEntity.class, height)) {
            store.save(BlockEntity.at(height));
            log.debug("Recorded block {}", height);
        }
        return new BlockContext(height);
    }

    public ClassEntity index(String entityId, int classId, BlockContext block) {
        ClassEntity saved = store.save(ClassEntity.created(entityId, classId, block.height()));
        log.debug("Indexed entity {} of class {} at block {}", entityId, classId, block.height());
        return saved;
    }

    public Optional<ClassEntity> find(String entityId) {
        return store.find(ClassEntity.class, entityId);
    }

    /**
     * Deletes the index row of an entity.
     *
     * @return false if the entity was not indexed
     */
    public boolean removeIndex(String entityId) {
        Optional<ClassEntity> classEntity = find(entityId);
        classEntity.ifPresent(store::remove);
        return classEntity.isPresent();
    }

    public Optional<Long> nextEntityId() {
        return store.find(NextEntityIdEntity.class, NextEntityIdEntity.SINGLETON_ID)
                .map(NextEntityIdEntity::getNextId);
    }

    /**
     * Moves the next entity id counter forward to {@code candidate}.
     * A lower candidate leaves the counter unchanged.
     */
    public void advanceNextEntityId(long candidate) {
        Optional<NextEntityIdEntity> counter =
                store.find(NextEntityIdEntity.class, NextEntityIdEntity.SINGLETON_ID);
        if (counter.isEmpty()) {
            store.save(NextEntityIdEntity.startingAt(candidate));
            log.debug("Next entity id starts at {}", candidate);
        } else if (counter.get().advanceTo(candidate)) {
            store.save(counter.get());
            log.debug("Next entity id is now {}", candidate);
        }
    }
}
