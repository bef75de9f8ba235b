package com.kotsin.nox.calculator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.kotsin.nox.calculator.ExactTimeLookback.NO_MATCH;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExactTimeLookback - Zero tolerance as-of match")
class ExactTimeLookbackTest {

    private static final long S = 1_000_000_000L;

    @Test
    @DisplayName("Regular sampling matches the row exactly w earlier")
    void testRegular() {
        long[] clock = {0, S, 2 * S, 3 * S, 4 * S};

        assertArrayEquals(new int[]{NO_MATCH, NO_MATCH, 0, 1, 2}, ExactTimeLookback.matchRows(clock, 2 * S));
    }

    @Test
    @DisplayName("Irregular sampling never falls back to the nearest earlier sample")
    void testIrregularHasNoNearestFallback() {
        long[] clock = {0, 1_500_000_000L, 3_200_000_000L, 61_700_000_000L};

        int[] matches = ExactTimeLookback.matchRows(clock, 60 * S);

        assertArrayEquals(new int[]{NO_MATCH, NO_MATCH, NO_MATCH, NO_MATCH}, matches);
        double[] values = ExactTimeLookback.valuesAt(new double[]{1, 2, 3, 4}, matches);
        for (double v : values) {
            assertTrue(Double.isNaN(v));
        }
    }

    @Test
    @DisplayName("Duplicate timestamps resolve to the last duplicate")
    void testDuplicatesTakeLast() {
        long[] clock = {0, 0, 10 * S, 10 * S};

        int[] matches = ExactTimeLookback.matchRows(clock, 10 * S);

        assertEquals(1, matches[2]);
        assertEquals(1, matches[3]);
    }

    @Test
    @DisplayName("Matched value may itself be missing")
    void testMissingMatchedValue() {
        double[] values = ExactTimeLookback.valuesAt(new double[]{Double.NaN, 2.0}, new int[]{NO_MATCH, 0});
        assertTrue(Double.isNaN(values[0]));
        assertTrue(Double.isNaN(values[1]));
    }

    @Test
    @DisplayName("Offset must be positive")
    void testInvalidOffset() {
        assertThrows(IllegalArgumentException.class, () -> ExactTimeLookback.matchRows(new long[]{0}, 0));
    }
}
