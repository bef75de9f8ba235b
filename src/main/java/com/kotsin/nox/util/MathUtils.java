package com.kotsin.nox.util;

import com.kotsin.nox.config.FeatureConstants;

import java.util.Arrays;

/**
 * MathUtils - Division guards and missing-value helpers for feature columns.
 *
 * Missing values are represented as {@link Double#NaN} throughout the pipeline.
 *
 * USAGE:
 * Instead of: double rate = delta / start;
 * Use: double rate = delta / MathUtils.nonZero(start);
 */
public final class MathUtils {

    private MathUtils() {
        throw new UnsupportedOperationException("Utility class");
    }

    // ======================== DIVISION GUARDS ========================

    /**
     * Replace an exact zero denominator with {@link FeatureConstants#EPSILON}.
     * NaN passes through so missing inputs stay missing.
     */
    public static double nonZero(double denominator) {
        return nonZero(denominator, FeatureConstants.EPSILON);
    }

    /**
     * Replace an exact zero denominator with {@code epsilon}.
     */
    public static double nonZero(double denominator, double epsilon) {
        return denominator == 0.0 ? epsilon : denominator;
    }

    /**
     * (end - start) / start with the zero guard applied to start
     */
    public static double rateOfChange(double end, double start, double epsilon) {
        return (end - start) / nonZero(start, epsilon);
    }

    // ======================== MISSING VALUES ========================

    public static boolean isMissing(double value) {
        return Double.isNaN(value);
    }

    /**
     * Infinite readings are treated as missing.
     */
    public static double finiteOrMissing(double value) {
        return Double.isFinite(value) ? value : Double.NaN;
    }

    public static double valueOrZero(double value) {
        return Double.isNaN(value) ? 0.0 : value;
    }

    public static long countMissing(double[] values) {
        long missing = 0;
        for (double v : values) {
            if (Double.isNaN(v)) {
                missing++;
            }
        }
        return missing;
    }

    /**
     * Forward-fill missing values; leading gaps stay missing.
     */
    public static double[] forwardFill(double[] values) {
        double[] filled = new double[values.length];
        double last = Double.NaN;
        for (int i = 0; i < values.length; i++) {
            if (!Double.isNaN(values[i])) {
                last = values[i];
            }
            filled[i] = last;
        }
        return filled;
    }

    /**
     * v[i] - v[i-1]; the first element and any difference touching a gap are missing.
     */
    public static double[] firstDifference(double[] values) {
        double[] diff = new double[values.length];
        if (values.length > 0) {
            diff[0] = Double.NaN;
        }
        for (int i = 1; i < values.length; i++) {
            diff[i] = values[i] - values[i - 1];
        }
        return diff;
    }

    public static double[] constant(int length, double value) {
        double[] column = new double[length];
        Arrays.fill(column, value);
        return column;
    }

    /**
     * 1.0 / 0.0 indicator; a missing input is never flagged.
     */
    public static double flag(boolean condition) {
        return condition ? 1.0 : 0.0;
    }
}
