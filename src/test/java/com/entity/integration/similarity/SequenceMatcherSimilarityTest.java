package com.entity.integration.similarity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class SequenceMatcherSimilarityTest {

    private static final double EPSILON = 1e-9;

    private SequenceMatcherSimilarity similarity;

    @BeforeEach
    void setUp() {
        similarity = new SequenceMatcherSimilarity();
    }

    @Test
    @DisplayName("Identical strings score 1.0")
    void identical() {
        assertEquals(1.0, similarity.compute("vienna", "vienna"));
        assertEquals(1.0, similarity.compute("", ""));
    }

    @Test
    @DisplayName("Null input scores 0.0")
    void nullInput() {
        assertEquals(0.0, similarity.compute(null, "vienna"));
        assertEquals(0.0, similarity.compute("vienna", null));
    }

    @Test
    @DisplayName("Empty against non-empty scores 0.0")
    void emptyAgainstNonEmpty() {
        assertEquals(0.0, similarity.compute("", "abc"));
    }

    @ParameterizedTest
    @DisplayName("Scores match the gestalt ratio 2*M/T")
    @CsvSource({
            "abcd,          bcde,              0.75",
            "vienna,        wien,              0.6",
            "french troops, the french troops, 0.8666666666666667",
            "french troops, french army,       0.6666666666666666",
            "paris,         parish,            0.9090909090909091",
            "austria,       austrians,         0.875",
            "abc,           xyz,               0.0"
    })
    void knownRatios(String s1, String s2, double expected) {
        assertEquals(expected, similarity.compute(s1, s2), EPSILON);
    }

    @Test
    @DisplayName("Score is symmetric even when longest blocks tie")
    void symmetric() {
        assertEquals(similarity.compute("tide", "diet"), similarity.compute("diet", "tide"));
        assertEquals(0.5, similarity.compute("tide", "diet"), EPSILON);
        assertEquals(similarity.compute("napoleon i", "napoleon bonaparte"),
                similarity.compute("napoleon bonaparte", "napoleon i"));
    }

    @Test
    @DisplayName("Popular characters in long strings extend but do not seed a block")
    void autojunkOnLongStrings() {
        String shortText = "aaaaaxyz";
        String longText = "b" + "a".repeat(250) + "xyz";
        // the block seeds on "xyz" and extends backwards over the five popular 'a's
        assertEquals(16.0 / 262.0, similarity.compute(shortText, longText), EPSILON);
    }

    @Test
    @DisplayName("Non-BMP characters count as single characters")
    void codePoints() {
        assertEquals(2.0 * 2 / 5, similarity.compute("a😀b", "ab"), EPSILON);
    }

    @Test
    @DisplayName("Algorithm name")
    void name() {
        assertEquals("SequenceMatcher", similarity.getName());
    }
}
