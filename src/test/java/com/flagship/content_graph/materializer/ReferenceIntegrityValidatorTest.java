package com.flagship.content_graph.materializer;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.content_graph.content.LanguageEntity;
import com.flagship.content_graph.content.VideoEntity;
import com.flagship.content_graph.schema.ClassSchemas;
import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.PropertyDecoder;
import com.flagship.content_graph.schema.properties.EntityProperties;
import com.flagship.content_graph.support.InMemoryEntityStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.flagship.content_graph.support.LedgerFixtures.channel;
import static com.flagship.content_graph.support.LedgerFixtures.classId;
import static com.flagship.content_graph.support.LedgerFixtures.existing;
import static com.flagship.content_graph.support.LedgerFixtures.internal;
import static com.flagship.content_graph.support.LedgerFixtures.language;
import static com.flagship.content_graph.support.LedgerFixtures.text;
import static com.flagship.content_graph.support.LedgerFixtures.values;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for reference resolution in batch and single-entity modes.
 */
class ReferenceIntegrityValidatorTest {

    private final PropertyDecoder decoder = new PropertyDecoder();
    private InMemoryEntityStore store;
    private ReferenceIntegrityValidator validator;

    @BeforeEach
    void setUp() {
        store = new InMemoryEntityStore();
        validator = new ReferenceIntegrityValidator(store);
    }

    private EntityProperties properties(KnownClass knownClass, ObjectNode rawValues) {
        return decoder.decode(knownClass, ClassSchemas.layoutOf(knownClass), rawValues);
    }

    private BatchEntity entity(int position, long entityId, KnownClass knownClass, ObjectNode rawValues) {
        return new BatchEntity(position, Long.toString(entityId), classId(knownClass), knownClass,
                properties(knownClass, rawValues));
    }

    private void persistLanguage(String id) {
        LanguageEntity language = new LanguageEntity();
        language.setId(id);
        store.save(language);
    }

    @Nested
    @DisplayName("Batch mode")
    class BatchMode {

        @Test
        @DisplayName("Forward reference to a later entity of the same batch resolves")
        void testForwardReferenceInBatch_Resolves() {
            BatchContext batch = BatchContext.of(100, List.of(
                    entity(0, 10, KnownClass.CHANNEL, channel("my-channel", internal(11))),
                    entity(1, 11, KnownClass.LANGUAGE, language("English", "en"))));

            assertTrue(validator.validate(batch).isApplicable());
        }

        @Test
        @DisplayName("Batch-local reference to an entity of another class is unresolved")
        void testBatchReferenceToWrongClass_Unresolved() {
            BatchContext batch = BatchContext.of(100, List.of(
                    entity(0, 10, KnownClass.CHANNEL, channel("my-channel", internal(11))),
                    entity(1, 11, KnownClass.CATEGORY, values(0, text("Music")))));

            BatchValidation validation = validator.validate(batch);

            assertFalse(validation.isApplicable());
            UnresolvedReference unresolved = validation.firstUnresolved().orElseThrow();
            assertEquals("10", unresolved.sourceEntityId());
            assertEquals(KnownClass.LANGUAGE, unresolved.property().targetClass());
        }

        @Test
        @DisplayName("Existing reference resolves against persisted rows only")
        void testExistingReferenceInBatch_UsesStore() {
            BatchContext missing = BatchContext.of(100, List.of(
                    entity(0, 10, KnownClass.CHANNEL, channel("my-channel", existing(5)))));
            assertFalse(validator.validate(missing).isApplicable());

            persistLanguage("5");
            assertTrue(validator.validate(missing).isApplicable());
        }

        @Test
        @DisplayName("Existing reference to a row of another class does not resolve")
        void testExistingReferenceToWrongClass_Unresolved() {
            VideoEntity video = new VideoEntity();
            video.setId("5");
            store.save(video);

            BatchContext batch = BatchContext.of(100, List.of(
                    entity(0, 10, KnownClass.CHANNEL, channel("my-channel", existing(5)))));

            assertFalse(validator.validate(batch).isApplicable());
        }

        @Test
        @DisplayName("Scan stops at the first unresolved reference in batch order")
        void testFirstUnresolved_InBatchOrder() {
            BatchContext batch = BatchContext.of(100, List.of(
                    entity(0, 10, KnownClass.LANGUAGE, language("English", "en")),
                    entity(1, 11, KnownClass.CHANNEL, channel("first", existing(90))),
                    entity(2, 12, KnownClass.CHANNEL, channel("second", existing(91)))));

            UnresolvedReference unresolved = validator.validate(batch).firstUnresolved().orElseThrow();

            assertEquals("11", unresolved.sourceEntityId());
            assertEquals("90", unresolved.property().reference().targetEntityId());
        }

        @Test
        @DisplayName("Batch entity without properties is not a reference target")
        void testBatchEntityWithoutProperties_NotATarget() {
            BatchContext batch = BatchContext.of(100, List.of(
                    new BatchEntity(0, "10", classId(KnownClass.LANGUAGE), KnownClass.LANGUAGE, null),
                    entity(1, 11, KnownClass.CHANNEL, channel("my-channel", internal(10)))));

            assertFalse(batch.introduces(KnownClass.LANGUAGE, "10"));
            assertFalse(validator.validate(batch).isApplicable());
        }

        @Test
        @DisplayName("Entities without properties or of unknown classes are not scanned")
        void testEntitiesWithoutProperties_Skipped() {
            BatchContext batch = BatchContext.of(100, List.of(
                    new BatchEntity(0, "10", 99, null, null),
                    new BatchEntity(1, "11", classId(KnownClass.LANGUAGE), KnownClass.LANGUAGE, null)));

            assertTrue(validator.validate(batch).isApplicable());
        }
    }

    @Nested
    @DisplayName("Single-entity mode")
    class SingleEntityMode {

        @Test
        @DisplayName("Persisted target resolves")
        void testPersistedTarget_Resolves() {
            persistLanguage("5");

            Optional<UnresolvedReference> unresolved = validator.findUnresolved("10",
                    properties(KnownClass.CHANNEL, channel("my-channel", existing(5))));

            assertTrue(unresolved.isEmpty());
        }

        @Test
        @DisplayName("Missing target is unresolved")
        void testMissingTarget_Unresolved() {
            Optional<UnresolvedReference> unresolved = validator.findUnresolved("10",
                    properties(KnownClass.CHANNEL, channel("my-channel", existing(5))));

            assertTrue(unresolved.isPresent());
            assertEquals(KnownClass.CHANNEL, unresolved.get().sourceClass());
        }

        @Test
        @DisplayName("Same-transaction reference never resolves outside a transaction")
        void testBatchLocalReference_UnresolvedOutsideBatch() {
            persistLanguage("5");

            Optional<UnresolvedReference> unresolved = validator.findUnresolved("10",
                    properties(KnownClass.CHANNEL, channel("my-channel", internal(5))));

            assertTrue(unresolved.isPresent());
        }

        @Test
        @DisplayName("Validation never writes to the store")
        void testValidation_DoesNotWrite() {
            int writesBefore = store.writes();

            validator.findUnresolved("10", properties(KnownClass.CHANNEL, channel("my-channel", existing(5))));
            validator.validate(BatchContext.of(100, List.of(
                    entity(0, 10, KnownClass.CHANNEL, channel("my-channel", internal(11))))));

            assertEquals(writesBefore, store.writes());
        }
    }
}
