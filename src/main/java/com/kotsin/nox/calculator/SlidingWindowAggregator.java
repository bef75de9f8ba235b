package com.kotsin.nox.calculator;

/**
 * SlidingWindowAggregator - Linear-time trailing aggregates over a sorted clock.
 *
 * A trailing window is described by a start row per row: row i aggregates rows
 * {@code starts[i]..i}. Start rows never decrease, which lets every aggregate advance
 * with an amortized O(1) step:
 * - mean / std / sum: running sums added on entry and removed on exit
 * - max / min: monotonic deque of row indices
 *
 * NaN inputs are skipped. Mean, sum, max and min need one valid value, std needs two;
 * otherwise the result is NaN.
 *
 * Thread-safety: stateless, thread-safe
 */
public final class SlidingWindowAggregator {

    private SlidingWindowAggregator() {
        throw new UnsupportedOperationException("Utility class");
    }

    // ======================== WINDOW BOUNDS ========================

    /**
     * Time window {@code (t - w, t]}: first row whose clock is strictly after {@code clock[i] - windowNanos}.
     *
     * @param clock ascending epoch nanoseconds
     */
    public static int[] timeWindowStarts(long[] clock, long windowNanos) {
        if (windowNanos <= 0) {
            throw new IllegalArgumentException("windowNanos must be positive: " + windowNanos);
        }
        int[] starts = new int[clock.length];
        int start = 0;
        for (int i = 0; i < clock.length; i++) {
            long lowerExclusive = clock[i] - windowNanos;
            while (clock[start] <= lowerExclusive) {
                start++;
            }
            starts[i] = start;
        }
        return starts;
    }

    /**
     * Sample window of the last {@code size} rows, truncated at the first row.
     */
    public static int[] countWindowStarts(int rowCount, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive: " + size);
        }
        int[] starts = new int[rowCount];
        for (int i = 0; i < rowCount; i++) {
            starts[i] = Math.max(0, i - size + 1);
        }
        return starts;
    }

    // ======================== MOMENTS ========================

    public static double[] mean(double[] values, int[] starts) {
        checkLengths(values, starts);
        double shift = firstValid(values);
        double[] result = new double[values.length];
        double sum = 0.0;
        int count = 0;
        int tail = 0;
        for (int i = 0; i < values.length; i++) {
            if (!Double.isNaN(values[i])) {
                sum += values[i] - shift;
                count++;
            }
            while (tail < starts[i]) {
                if (!Double.isNaN(values[tail])) {
                    sum -= values[tail] - shift;
                    count--;
                }
                tail++;
            }
            result[i] = count == 0 ? Double.NaN : shift + sum / count;
        }
        return result;
    }

    /**
     * Sample standard deviation (n - 1 denominator).
     */
    public static double[] std(double[] values, int[] starts) {
        checkLengths(values, starts);
        double shift = firstValid(values);
        double[] result = new double[values.length];
        double sum = 0.0;
        double sumSq = 0.0;
        int count = 0;
        int tail = 0;
        for (int i = 0; i < values.length; i++) {
            if (!Double.isNaN(values[i])) {
                double d = values[i] - shift;
                sum += d;
                sumSq += d * d;
                count++;
            }
            while (tail < starts[i]) {
                if (!Double.isNaN(values[tail])) {
                    double d = values[tail] - shift;
                    sum -= d;
                    sumSq -= d * d;
                    count--;
                }
                tail++;
            }
            if (count < 2) {
                result[i] = Double.NaN;
            } else {
                double variance = (sumSq - sum * sum / count) / (count - 1);
                result[i] = variance <= 0.0 ? 0.0 : Math.sqrt(variance);
            }
        }
        return result;
    }

    public static double[] sum(double[] values, int[] starts) {
        checkLengths(values, starts);
        double[] result = new double[values.length];
        double sum = 0.0;
        int count = 0;
        int tail = 0;
        for (int i = 0; i < values.length; i++) {
            if (!Double.isNaN(values[i])) {
                sum += values[i];
                count++;
            }
            while (tail < starts[i]) {
                if (!Double.isNaN(values[tail])) {
                    sum -= values[tail];
                    count--;
                }
                tail++;
            }
            result[i] = count == 0 ? Double.NaN : sum;
        }
        return result;
    }

    // ======================== EXTREMES ========================

    public static double[] max(double[] values, int[] starts) {
        return extreme(values, starts, true);
    }

    public static double[] min(double[] values, int[] starts) {
        return extreme(values, starts, false);
    }

    /**
     * Max over the last {@code size} rows, NaN unless all {@code size} rows exist and are valid.
     */
    public static double[] fullCountWindowMax(double[] values, int size) {
        int[] starts = countWindowStarts(values.length, size);
        double[] result = max(values, starts);
        int missingInWindow = 0;
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) {
                missingInWindow++;
            }
            int leaving = i - size;
            if (leaving >= 0 && Double.isNaN(values[leaving])) {
                missingInWindow--;
            }
            if (i < size - 1 || missingInWindow > 0) {
                result[i] = Double.NaN;
            }
        }
        return result;
    }

    private static double[] extreme(double[] values, int[] starts, boolean maximum) {
        checkLengths(values, starts);
        double[] result = new double[values.length];
        int[] deque = new int[values.length];
        int head = 0;
        int tail = 0;
        for (int i = 0; i < values.length; i++) {
            double v = values[i];
            if (!Double.isNaN(v)) {
                while (tail > head && dominated(values[deque[tail - 1]], v, maximum)) {
                    tail--;
                }
                deque[tail++] = i;
            }
            while (tail > head && deque[head] < starts[i]) {
                head++;
            }
            result[i] = tail > head ? values[deque[head]] : Double.NaN;
        }
        return result;
    }

    private static boolean dominated(double queued, double incoming, boolean maximum) {
        return maximum ? queued <= incoming : queued >= incoming;
    }

    private static double firstValid(double[] values) {
        for (double v : values) {
            if (!Double.isNaN(v)) {
                return v;
            }
        }
        return 0.0;
    }

    private static void checkLengths(double[] values, int[] starts) {
        if (values.length != starts.length) {
            throw new IllegalArgumentException("values (" + values.length + ") and starts ("
                + starts.length + ") differ in length");
        }
    }
}
