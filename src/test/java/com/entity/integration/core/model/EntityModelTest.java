package com.entity.integration.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Entity model Tests")
class EntityModelTest {

    @Nested
    @DisplayName("Enumerations")
    class Enumerations {

        @ParameterizedTest
        @DisplayName("EntityType parses names case-insensitively")
        @CsvSource({"PERSON, PERSON", "location, LOCATION", " Time , TIME"})
        void entityTypeFromValue(String value, EntityType expected) {
            assertEquals(Optional.of(expected), EntityType.fromValue(value));
        }

        @Test
        @DisplayName("Unknown entity types are empty")
        void unknownEntityType() {
            assertTrue(EntityType.fromValue("SPACESHIP").isEmpty());
            assertTrue(EntityType.fromValue(null).isEmpty());
            assertTrue(EntityType.fromValue("  ").isEmpty());
            assertEquals("Location", EntityType.LOCATION.getLabel());
        }

        @Test
        @DisplayName("Precision ranks order from coarse to fine; unknown values rank lowest")
        void precisionRanks() {
            assertTrue(TimePrecision.DAY.isFinerThan(TimePrecision.YEAR));
            assertFalse(TimePrecision.YEAR.isFinerThan(TimePrecision.DAY));
            assertTrue(TimePrecision.YEAR.isFinerThan(null));
            assertEquals(TimePrecision.MONTH, TimePrecision.fromValue("month"));
            assertEquals(TimePrecision.UNKNOWN, TimePrecision.fromValue("decade"));
            assertEquals(0, TimePrecision.fromValue(null).getRank());
            assertEquals(TimeType.PERIOD, TimeType.fromValue("period"));
            assertEquals(TimeType.UNKNOWN, TimeType.fromValue("range"));
        }
    }

    @Nested
    @DisplayName("Global records")
    class GlobalRecords {

        @Test
        @DisplayName("Entity sources are a set in first-seen order")
        void entitySources() {
            GlobalEntity entity = GlobalEntity.builder()
                    .id("g1").type(EntityType.PERSON).text("Napoleon").source("doc1")
                    .build();

            assertTrue(entity.addSource("doc2"));
            assertFalse(entity.addSource("doc1"));
            assertEquals(List.of("doc1", "doc2"), entity.getSources());
            assertThrows(UnsupportedOperationException.class, () -> entity.getSources().add("doc3"));
        }

        @Test
        @DisplayName("Entity builder requires id, type and text")
        void entityRequiredFields() {
            assertThrows(NullPointerException.class,
                    () -> GlobalEntity.builder().type(EntityType.PERSON).text("x").build());
            assertThrows(NullPointerException.class,
                    () -> GlobalEntity.builder().id("g1").text("x").build());
        }

        @Test
        @DisplayName("Relation confidence only rises")
        void relationConfidence() {
            GlobalRelation relation = GlobalRelation.builder()
                    .id("R1").subject("a").predicate("met").object("b").confidence(0.6)
                    .build();

            relation.raiseConfidence(0.4);
            assertEquals(0.6, relation.getConfidence());
            relation.raiseConfidence(0.9);
            assertEquals(0.9, relation.getConfidence());
        }

        @Test
        @DisplayName("Comparable text prefers the normalized form")
        void comparableText() {
            CandidateEntity withNormalized = CandidateEntity.of(
                    new LocalEntity("e1", EntityType.PERSON, "Bonaparte", "Napoleon Bonaparte", 0.9));
            CandidateEntity withoutNormalized = CandidateEntity.of(
                    new LocalEntity("e2", EntityType.PERSON, "Bonaparte", null, 0.9));

            assertEquals("Napoleon Bonaparte", withNormalized.getComparableText());
            assertEquals("Bonaparte", withoutNormalized.getComparableText());
            assertEquals("e1", withNormalized.getLocalId());
        }

        @Test
        @DisplayName("Attribute copies are detached")
        void attributeCopies() {
            LocationAttributes original = LocationAttributes.builder().coordinates(48.2, 16.3).build();
            LocationAttributes copy = original.copy();
            copy.setLatitude(50.0);

            assertEquals(48.2, original.getLatitude());
            assertTrue(copy.hasCoordinates());
        }

        @Test
        @DisplayName("Document record tolerates null sections")
        void documentRecordNulls() {
            DocumentRecord record = new DocumentRecord(null, null, null, null);
            assertTrue(record.entities().isEmpty());
            assertTrue(record.timeperiods().isEmpty());
        }
    }
}
