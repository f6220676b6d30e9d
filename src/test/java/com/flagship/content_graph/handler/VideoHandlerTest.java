package com.flagship.content_graph.handler;

import com.flagship.content_graph.content.VideoEntity;
import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.Reference;
import com.flagship.content_graph.schema.properties.CategoryProperties;
import com.flagship.content_graph.schema.properties.VideoProperties;
import com.flagship.content_graph.support.InMemoryEntityStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the shared create/update/remove lifecycle, through the handler
 * with the widest property set.
 */
class VideoHandlerTest {

    private InMemoryEntityStore store;
    private VideoHandler handler;

    @BeforeEach
    void setUp() {
        store = new InMemoryEntityStore();
        handler = new VideoHandler(store);
    }

    private static VideoProperties video(String title, Long duration, Reference channel) {
        return new VideoProperties(channel, null, title, null, duration, null, null,
                null, null, null, null, Boolean.TRUE, null, null, null);
    }

    @Test
    @DisplayName("Create stores every present property and references as target ids")
    void testCreate_StoresProperties() {
        handler.create(new BlockContext(300), "40", video("Intro", 95L, Reference.existing("10")));

        VideoEntity row = store.get(VideoEntity.class, "40");
        assertEquals("Intro", row.getTitle());
        assertEquals(95L, row.getDuration());
        assertEquals("10", row.getChannelId());
        assertEquals(Boolean.TRUE, row.getIsPublic());
        assertNull(row.getCategoryId());
        assertEquals(300, row.getVersion());
    }

    @Test
    @DisplayName("Repeated create keeps absent properties and the higher version")
    void testRepeatedCreate_KeepsExistingRow() {
        handler.create(new BlockContext(300), "40", video("Intro", 95L, Reference.existing("10")));

        handler.create(new BlockContext(290), "40", video("Intro (recut)", null, null));

        VideoEntity row = store.get(VideoEntity.class, "40");
        assertEquals("Intro (recut)", row.getTitle());
        assertEquals(95L, row.getDuration());
        assertEquals("10", row.getChannelId());
        assertEquals(300, row.getVersion());
        assertEquals(290, row.getHappenedIn());
        assertEquals(1, store.count(VideoEntity.class));
    }

    @Test
    @DisplayName("Update keeps properties that are absent from the update")
    void testUpdate_KeepsAbsentProperties() {
        handler.create(new BlockContext(300), "40", video("Intro", 95L, Reference.existing("10")));

        boolean updated = handler.update(new BlockContext(305), "40", video("Intro (remastered)", null, null));

        assertTrue(updated);
        VideoEntity row = store.get(VideoEntity.class, "40");
        assertEquals("Intro (remastered)", row.getTitle());
        assertEquals(95L, row.getDuration());
        assertEquals("10", row.getChannelId());
        assertEquals(305, row.getVersion());
    }

    @Test
    @DisplayName("Update without a row reports false and writes nothing")
    void testUpdateMissingRow_ReturnsFalse() {
        assertFalse(handler.update(new BlockContext(305), "40", video("Intro", null, null)));
        assertEquals(0, store.writes());
    }

    @Test
    @DisplayName("Remove deletes the row and reports whether it existed")
    void testRemove() {
        handler.create(new BlockContext(300), "40", video("Intro", null, null));

        assertTrue(handler.remove("40"));
        assertFalse(handler.remove("40"));
        assertEquals(0, store.count(VideoEntity.class));
    }

    @Test
    @DisplayName("Properties of another class are rejected")
    void testForeignProperties_Rejected() {
        assertEquals(KnownClass.VIDEO, handler.knownClass());
        assertThrows(IllegalArgumentException.class,
                () -> handler.create(new BlockContext(300), "40", new CategoryProperties("Music", null)));
    }

    @Test
    @DisplayName("Negative block height is rejected")
    void testNegativeBlockHeight_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> new BlockContext(-1));
    }
}
