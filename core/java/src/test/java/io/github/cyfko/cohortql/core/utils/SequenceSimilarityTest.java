package io.github.cyfko.cohortql.core.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SequenceSimilarityTest {

    @Test
    @DisplayName("Should score identical and empty strings as fully similar")
    void shouldScoreIdentical() {
        assertEquals(1.0, SequenceSimilarity.ratio("ethnicity", "ethnicity"));
        assertEquals(1.0, SequenceSimilarity.ratio("", ""));
    }

    @Test
    @DisplayName("Should score disjoint strings as zero")
    void shouldScoreDisjoint() {
        assertEquals(0.0, SequenceSimilarity.ratio("abc", "xyz"));
        assertEquals(0.0, SequenceSimilarity.ratio("abc", ""));
    }

    @Test
    @DisplayName("Should count matching blocks around the longest common substring")
    void shouldCountMatchingBlocks() {
        assertEquals(0.75, SequenceSimilarity.ratio("abcd", "bcde"), 1e-12);
        assertEquals(16.0 / 17.0, SequenceSimilarity.ratio("etnicity", "ethnicity"), 1e-12);
        assertEquals(6.0 / 9.0, SequenceSimilarity.ratio("mal", "female"), 1e-12);
    }

    @Test
    @DisplayName("Should depend on argument order like a block matcher")
    void shouldBeOrderSensitive() {
        assertEquals(0.25, SequenceSimilarity.ratio("tide", "diet"), 1e-12);
        assertEquals(0.5, SequenceSimilarity.ratio("diet", "tide"), 1e-12);
    }
}
