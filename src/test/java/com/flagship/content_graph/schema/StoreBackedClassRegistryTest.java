package com.flagship.content_graph.schema;

import com.flagship.content_graph.store.ClassEntity;
import com.flagship.content_graph.support.InMemoryEntityStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.flagship.content_graph.support.LedgerFixtures.UNKNOWN_CLASS_ID;
import static com.flagship.content_graph.support.LedgerFixtures.UNKNOWN_CLASS_NAME;
import static com.flagship.content_graph.support.LedgerFixtures.UNREGISTERED_CLASS_ID;
import static com.flagship.content_graph.support.LedgerFixtures.classId;
import static com.flagship.content_graph.support.LedgerFixtures.registeredClasses;
import static org.junit.jupiter.api.Assertions.*;

class StoreBackedClassRegistryTest {

    private InMemoryEntityStore store;
    private StoreBackedClassRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemoryEntityStore();
        registry = new StoreBackedClassRegistry(store, registeredClasses());
    }

    @Test
    @DisplayName("Indexed entity of a known class resolves to that class")
    void testIndexedEntity_ResolvesKnownClass() {
        store.save(ClassEntity.created("10", classId(KnownClass.VIDEO), 100));

        ClassResolution resolution = registry.resolveClass("10");

        assertTrue(resolution.isIndexed());
        assertTrue(resolution.isRegistered());
        assertEquals(KnownClass.VIDEO, resolution.knownClass().orElseThrow());
    }

    @Test
    @DisplayName("Entity without an index row is unindexed")
    void testMissingEntity_Unindexed() {
        ClassResolution resolution = registry.resolveClass("404");

        assertFalse(resolution.isIndexed());
        assertFalse(resolution.isRegistered());
        assertTrue(resolution.knownClass().isEmpty());
    }

    @Test
    @DisplayName("Class id without a name is unregistered")
    void testUnmappedClassId_Unregistered() {
        store.save(ClassEntity.created("20", UNREGISTERED_CLASS_ID, 100));

        ClassResolution resolution = registry.resolveClass("20");

        assertTrue(resolution.isIndexed());
        assertFalse(resolution.isRegistered());
    }

    @Test
    @DisplayName("Registered name outside the known classes has no known class")
    void testUnknownClassName() {
        ClassResolution resolution = registry.classOf(UNKNOWN_CLASS_ID);

        assertEquals(UNKNOWN_CLASS_NAME, resolution.className());
        assertTrue(resolution.knownClass().isEmpty());
    }

    @Test
    @DisplayName("Every known class has a layout whose references target known classes")
    void testLayouts_Complete() {
        Map<KnownClass, List<PropertyDefinition>> layouts = ClassSchemas.all();

        assertEquals(KnownClass.values().length, layouts.size());
        for (KnownClass knownClass : KnownClass.values()) {
            for (PropertyDefinition definition : registry.propertyLayout(knownClass)) {
                assertEquals(definition.type() == PropertyType.REFERENCE, definition.targetClass() != null,
                        knownClass + "." + definition.name());
            }
        }
    }
}
