package com.flagship.content_graph.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NextEntityIdEntityTest {

    @Test
    @DisplayName("Counter advances to a higher id")
    void testAdvance_Forward() {
        NextEntityIdEntity counter = NextEntityIdEntity.startingAt(11);

        assertTrue(counter.advanceTo(15));
        assertEquals(15, counter.getNextId());
        assertEquals(NextEntityIdEntity.SINGLETON_ID, counter.getId());
    }

    @Test
    @DisplayName("Counter ignores lower or equal ids")
    void testAdvance_NeverBackwards() {
        NextEntityIdEntity counter = NextEntityIdEntity.startingAt(11);

        assertFalse(counter.advanceTo(11));
        assertFalse(counter.advanceTo(3));
        assertEquals(11, counter.getNextId());
    }
}
