package com.entity.integration.identity;

import com.entity.integration.core.model.CandidateEntity;
import com.entity.integration.core.model.EntityType;
import com.entity.integration.core.model.LocalEntity;
import com.entity.integration.core.model.LocationAttributes;
import com.entity.integration.core.model.TimeAttributes;
import com.entity.integration.core.model.TimePrecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IdentityAssigner Tests")
class IdentityAssignerTest {

    private IdentityAssigner assigner;

    @BeforeEach
    void setUp() {
        assigner = new IdentityAssigner();
    }

    @Nested
    @DisplayName("Signatures")
    class Signatures {

        @Test
        @DisplayName("Text signature lowercases and replaces spaces with underscores")
        void textSignature() {
            assertEquals("PERSON_napoleon_bonaparte",
                    assigner.signature(EntityType.PERSON, "Napoleon Bonaparte", null, null));
        }

        @Test
        @DisplayName("LOCATION with coordinates uses rounded coordinates")
        void locationSignature() {
            LocationAttributes location = LocationAttributes.builder().coordinates(48.2082, 16.3738).build();
            assertEquals("LOC_48.2082_16.3738",
                    assigner.signature(EntityType.LOCATION, "Vienna", location, null));
        }

        @Test
        @DisplayName("LOCATION without coordinates falls back to text")
        void locationWithoutCoordinates() {
            LocationAttributes location = LocationAttributes.builder().displayName("Wien").build();
            assertEquals("LOCATION_vienna",
                    assigner.signature(EntityType.LOCATION, "Vienna", location, null));
        }

        @Test
        @DisplayName("TIME with a start date uses the date")
        void timeSignature() {
            TimeAttributes time = TimeAttributes.builder()
                    .precision(TimePrecision.DAY)
                    .startDate("1805-11-13")
                    .build();
            assertEquals("TIME_1805-11-13",
                    assigner.signature(EntityType.TIME, "13 November 1805", null, time));
        }

        @Test
        @DisplayName("Coordinates only apply to LOCATION entities")
        void coordinatesIgnoredForOtherTypes() {
            LocationAttributes location = LocationAttributes.builder().coordinates(48.2082, 16.3738).build();
            assertEquals("EVENT_congress",
                    assigner.signature(EntityType.EVENT, "Congress", location, null));
        }

        @Test
        @DisplayName("Missing text yields the bare type prefix")
        void missingText() {
            assertEquals("CONCEPT_", assigner.signature(EntityType.CONCEPT, null, null, null));
        }

        @ParameterizedTest
        @DisplayName("Coordinates are rounded to five decimal places")
        @CsvSource({
                "48.208249999, 48.20825",
                "48.2,         48.2",
                "16.0,         16.0",
                "-0.1234567,   -0.12346",
                "100.0,        100.0",
                "0.00012,      0.00012",
                "0.0001,       0.0001",
                "0.00005,      5e-05",
                "0.0000449,    4e-05",
                "-0.00003,     -3e-05",
                "-0.000001,    -0.0"
        })
        void roundsCoordinates(double value, String expected) {
            assertEquals(expected, IdentityAssigner.roundCoordinate(value));
        }

        @Test
        @DisplayName("Near-zero coordinates keep their short exponent form in the id")
        void nearZeroCoordinateId() {
            LocationAttributes location = LocationAttributes.builder().latitude(0.00005).longitude(0.00012).build();
            assertEquals("LOC_5e-05_0.00012", assigner.signature(EntityType.LOCATION, "Null Island", location, null));
            assertEquals("04fdf437dc9f", assigner.assign(EntityType.LOCATION, "Null Island", location, null));
        }

        @Test
        @DisplayName("Non-finite coordinates are rejected")
        void rejectsNonFinite() {
            assertThrows(IllegalArgumentException.class, () -> IdentityAssigner.roundCoordinate(Double.NaN));
            assertThrows(IllegalArgumentException.class,
                    () -> IdentityAssigner.roundCoordinate(Double.POSITIVE_INFINITY));
        }
    }

    @Nested
    @DisplayName("Ids")
    class Ids {

        @Test
        @DisplayName("Id is the first 12 hex characters of the signature's MD5")
        void idIsMd5Prefix() {
            assertEquals("358ecf67c6df", assigner.assign(EntityType.PERSON, "napoleon bonaparte", null, null));

            LocationAttributes location = LocationAttributes.builder().coordinates(48.2082, 16.3738).build();
            assertEquals("f2534830c203", assigner.assign(EntityType.LOCATION, "Vienna", location, null));
        }

        @Test
        @DisplayName("Same inputs always produce the same id")
        void idempotent() {
            String first = assigner.assign(EntityType.ORGANIZATION, "French troops", null, null);
            String second = new IdentityAssigner().assign(EntityType.ORGANIZATION, "French troops", null, null);
            assertEquals(first, second);
            assertEquals(IdentityAssigner.ID_LENGTH, first.length());
            assertTrue(first.matches("[0-9a-f]{12}"));
        }

        @Test
        @DisplayName("Different texts of the same place share an id through coordinates")
        void coordinatesDominateText() {
            LocationAttributes location = LocationAttributes.builder().coordinates(48.2082, 16.3738).build();
            assertEquals(
                    assigner.assign(EntityType.LOCATION, "Vienna", location, null),
                    assigner.assign(EntityType.LOCATION, "Wien", location.copy(), null));
        }

        @Test
        @DisplayName("Candidate uses the normalized form when present")
        void candidateUsesNormalized() {
            CandidateEntity candidate = CandidateEntity.of(
                    new LocalEntity("e1", EntityType.PERSON, "Bonaparte", "Napoleon Bonaparte", 0.9));
            assertEquals("358ecf67c6df", assigner.assign(candidate));
        }
    }

    @Nested
    @DisplayName("ContentHash")
    class ContentHashTests {

        @Test
        @DisplayName("md5Hex matches the well-known digest of the empty string")
        void emptyStringDigest() {
            assertEquals("d41d8cd98f00b204e9800998ecf8427e", ContentHash.md5Hex(""));
        }

        @Test
        @DisplayName("md5Prefix rejects out of range lengths")
        void prefixRange() {
            assertThrows(IllegalArgumentException.class, () -> ContentHash.md5Prefix("x", 0));
            assertThrows(IllegalArgumentException.class, () -> ContentHash.md5Prefix("x", 33));
            assertEquals("78d878304b6", ContentHash.md5Prefix("TIME_1805-11-13", 11));
        }
    }
}
