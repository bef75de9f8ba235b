package com.kotsin.nox.calculator;

import java.util.Arrays;

/**
 * ExactTimeLookback - Backward as-of join with zero tolerance.
 *
 * For row i the lookback row is the last row j with {@code clock[j] + offset <= clock[i]},
 * accepted only when {@code clock[j] + offset == clock[i]}. Irregular sampling therefore
 * yields no match (NaN) rather than the nearest earlier sample.
 *
 * Both sides walk the same ascending clock, so the match is a single two-pointer pass.
 */
public final class ExactTimeLookback {

    public static final int NO_MATCH = -1;

    private ExactTimeLookback() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @param clock       ascending epoch nanoseconds
     * @param offsetNanos lookback distance, positive
     * @return per row the matched row, or {@link #NO_MATCH}
     */
    public static int[] matchRows(long[] clock, long offsetNanos) {
        if (offsetNanos <= 0) {
            throw new IllegalArgumentException("offsetNanos must be positive: " + offsetNanos);
        }
        int[] matches = new int[clock.length];
        int next = 0;
        for (int i = 0; i < clock.length; i++) {
            while (next < clock.length && clock[next] + offsetNanos <= clock[i]) {
                next++;
            }
            int candidate = next - 1;
            matches[i] = candidate >= 0 && clock[candidate] + offsetNanos == clock[i] ? candidate : NO_MATCH;
        }
        return matches;
    }

    /**
     * Values at the matched rows; NaN where there was no match.
     */
    public static double[] valuesAt(double[] values, int[] matches) {
        double[] result = new double[matches.length];
        Arrays.fill(result, Double.NaN);
        for (int i = 0; i < matches.length; i++) {
            if (matches[i] != NO_MATCH) {
                result[i] = values[matches[i]];
            }
        }
        return result;
    }
}
