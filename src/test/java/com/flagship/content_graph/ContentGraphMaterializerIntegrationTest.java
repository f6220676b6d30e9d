package com.flagship.content_graph;

import com.flagship.content_graph.content.ChannelEntity;
import com.flagship.content_graph.content.LanguageEntity;
import com.flagship.content_graph.event.LedgerEvent;
import com.flagship.content_graph.event.LedgerTransaction;
import com.flagship.content_graph.exception.BatchOrderingException;
import com.flagship.content_graph.materializer.DispatchOutcome;
import com.flagship.content_graph.materializer.EntityEventDispatcher;
import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.store.BlockEntity;
import com.flagship.content_graph.store.ClassEntity;
import com.flagship.content_graph.store.EntityStore;
import com.flagship.content_graph.store.JpaEntityStore;
import com.flagship.content_graph.store.NextEntityIdEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.flagship.content_graph.support.LedgerFixtures.channel;
import static com.flagship.content_graph.support.LedgerFixtures.classId;
import static com.flagship.content_graph.support.LedgerFixtures.create;
import static com.flagship.content_graph.support.LedgerFixtures.existing;
import static com.flagship.content_graph.support.LedgerFixtures.internal;
import static com.flagship.content_graph.support.LedgerFixtures.language;
import static com.flagship.content_graph.support.LedgerFixtures.schemaSupport;
import static com.flagship.content_graph.support.LedgerFixtures.text;
import static com.flagship.content_graph.support.LedgerFixtures.update;
import static com.flagship.content_graph.support.LedgerFixtures.values;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end materialization against PostgreSQL.
 *
 * These tests verify that:
 * - Typed rows and the entity index are persisted through JPA
 * - Ledger transactions are applied with forward references
 * - Ignored and failed transactions leave no rows behind
 * - A store failure midway through a dispatch rolls back its earlier writes
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class ContentGraphMaterializerIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("content_graph_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // Disable Kafka for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
    }

    @Autowired
    private EntityEventDispatcher dispatcher;

    @Autowired
    private EntityStore store;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private FailingEntityStore failingStore;

    @BeforeEach
    void setUp() {
        failingStore.reset();
        jdbcTemplate.update("DELETE FROM next_entity_id");
    }

    @Test
    @DisplayName("Entity lifecycle is persisted from creation to removal")
    void testEntityLifecycle_Persisted() {
        assertTrue(dispatcher.dispatch(LedgerEvent.entityCreated(100, 5, classId(KnownClass.LANGUAGE))).isApplied());
        assertTrue(dispatcher.dispatch(schemaSupport(100, 5, language("English", "en"))).isApplied());
        assertTrue(dispatcher.dispatch(update(101, 5, values(1, text("en-GB")))).isApplied());

        LanguageEntity language = store.find(LanguageEntity.class, "5").orElseThrow();
        assertEquals("English", language.getName());
        assertEquals("en-GB", language.getCode());
        assertEquals(101, language.getVersion());
        assertNotNull(language.getCreatedAt());
        assertTrue(store.exists(BlockEntity.class, 101L));
        assertEquals(6, store.find(NextEntityIdEntity.class, NextEntityIdEntity.SINGLETON_ID)
                .orElseThrow().getNextId());

        assertTrue(dispatcher.dispatch(LedgerEvent.entityRemoved(102, 5)).isApplied());
        assertFalse(store.exists(LanguageEntity.class, "5"));
        assertFalse(store.exists(ClassEntity.class, "5"));
    }

    @Test
    @DisplayName("Ledger transaction with a forward reference is persisted")
    void testTransactionWithForwardReference_Persisted() {
        DispatchOutcome outcome = dispatcher.dispatchTransaction(new LedgerTransaction(200, List.of(
                create(20, KnownClass.CHANNEL, channel("my-channel", internal(21))),
                create(21, KnownClass.LANGUAGE, language("English", "en")))));

        assertTrue(outcome.isApplied());
        assertEquals("21", store.find(ChannelEntity.class, "20").orElseThrow().getLanguageId());
        assertTrue(store.exists(LanguageEntity.class, "21"));
        assertEquals(KnownClass.CHANNEL.ordinal() + 1,
                store.find(ClassEntity.class, "20").orElseThrow().getClassId());
    }

    @Test
    @DisplayName("Ignored transaction persists nothing")
    void testIgnoredTransaction_PersistsNothing() {
        DispatchOutcome outcome = dispatcher.dispatchTransaction(new LedgerTransaction(300, List.of(
                create(30, KnownClass.LANGUAGE, language("German", "de")),
                create(31, KnownClass.CHANNEL, channel("kanal", existing(9_999))))));

        assertTrue(outcome.isDropped());
        assertFalse(store.exists(ClassEntity.class, "30"));
        assertFalse(store.exists(LanguageEntity.class, "30"));
        assertFalse(store.exists(BlockEntity.class, 300L));
    }

    @Test
    @DisplayName("Out-of-order transaction is rejected before any write")
    void testOutOfOrderTransaction_Rejected() {
        dispatcher.dispatch(LedgerEvent.entityCreated(400, 50, classId(KnownClass.CATEGORY)));

        assertThrows(BatchOrderingException.class, () -> dispatcher.dispatchTransaction(
                new LedgerTransaction(401, List.of(
                        create(40, KnownClass.LANGUAGE, language("French", "fr"))))));

        assertFalse(store.exists(ClassEntity.class, "40"));
        assertFalse(store.exists(BlockEntity.class, 401L));
    }

    @Test
    @DisplayName("Store failure midway through a validated transaction rolls back every write")
    void testStoreFailureInTransaction_RolledBack() {
        failingStore.failSave(LanguageEntity.class, 2);

        assertThrows(DataAccessException.class, () -> dispatcher.dispatchTransaction(
                new LedgerTransaction(500, List.of(
                        create(60, KnownClass.LANGUAGE, language("Polish", "pl")),
                        create(61, KnownClass.LANGUAGE, language("Czech", "cs"))))));

        assertFalse(store.exists(LanguageEntity.class, "60"));
        assertFalse(store.exists(ClassEntity.class, "60"));
        assertFalse(store.exists(ClassEntity.class, "61"));
        assertFalse(store.exists(BlockEntity.class, 500L));
        assertTrue(store.find(NextEntityIdEntity.class, NextEntityIdEntity.SINGLETON_ID).isEmpty());
    }

    @Test
    @DisplayName("Removal deletes both rows or neither")
    void testStoreFailureInRemoval_KeepsBothRows() {
        dispatcher.dispatch(LedgerEvent.entityCreated(600, 70, classId(KnownClass.LANGUAGE)));
        dispatcher.dispatch(schemaSupport(600, 70, language("Dutch", "nl")));
        failingStore.failRemove(ClassEntity.class, 1);

        assertThrows(DataAccessException.class, () -> dispatcher.dispatch(LedgerEvent.entityRemoved(601, 70)));

        assertTrue(store.exists(LanguageEntity.class, "70"));
        assertTrue(store.exists(ClassEntity.class, "70"));
    }

    @TestConfiguration
    static class FailureInjectionConfig {

        @Bean
        @Primary
        FailingEntityStore failingEntityStore(JpaEntityStore delegate) {
            return new FailingEntityStore(delegate);
        }
    }

    /**
     * Delegates to the JPA store and fails the n-th save or remove of a row type.
     */
    static class FailingEntityStore implements EntityStore {

        private final EntityStore delegate;
        private final Map<Class<?>, Integer> saveCountdown = new HashMap<>();
        private final Map<Class<?>, Integer> removeCountdown = new HashMap<>();

        FailingEntityStore(EntityStore delegate) {
            this.delegate = delegate;
        }

        void failSave(Class<?> type, int nth) {
            saveCountdown.put(type, nth);
        }

        void failRemove(Class<?> type, int nth) {
            removeCountdown.put(type, nth);
        }

        void reset() {
            saveCountdown.clear();
            removeCountdown.clear();
        }

        @Override
        public <T> Optional<T> find(Class<T> type, Object id) {
            return delegate.find(type, id);
        }

        @Override
        public <T> T save(T row) {
            countDown(saveCountdown, row, "save");
            return delegate.save(row);
        }

        @Override
        public void remove(Object row) {
            countDown(removeCountdown, row, "remove");
            delegate.remove(row);
        }

        private static void countDown(Map<Class<?>, Integer> countdown, Object row, String operation) {
            Integer remaining = countdown.get(row.getClass());
            if (remaining == null) {
                return;
            }
            if (remaining == 1) {
                countdown.remove(row.getClass());
                throw new DataAccessResourceFailureException(
                        "Simulated failure on " + operation + " of " + row.getClass().getSimpleName());
            }
            countdown.put(row.getClass(), remaining - 1);
        }
    }
}
