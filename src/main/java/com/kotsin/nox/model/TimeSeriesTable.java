package com.kotsin.nox.model;

import com.kotsin.nox.config.FeatureConstants;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * TimeSeriesTable - Column-oriented table of numeric sensor channels.
 *
 * Missing values are NaN. Columns keep insertion order and are only ever added or replaced,
 * never removed, so every pipeline stage sees the full row set.
 *
 * Before indexing the table may carry a raw (unparsed) timestamp column. After
 * {@link #indexBy(String, long[])} rows are ordered by an epoch-nanosecond index.
 *
 * Not thread-safe. One instance belongs to one pipeline run.
 */
public class TimeSeriesTable {

    private final int rowCount;
    private final Map<String, double[]> columns = new LinkedHashMap<>();

    private String rawTimestampName;
    private List<String> rawTimestamps;

    private String indexName;
    private long[] index;

    public TimeSeriesTable(int rowCount) {
        if (rowCount < 0) {
            throw new IllegalArgumentException("rowCount must not be negative: " + rowCount);
        }
        this.rowCount = rowCount;
    }

    public int rowCount() {
        return rowCount;
    }

    // ========== COLUMNS ==========

    /**
     * Add or replace a column. The array is stored as given, not copied.
     */
    public TimeSeriesTable putColumn(String name, double[] values) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Column name must not be empty");
        }
        if (values == null || values.length != rowCount) {
            throw new IllegalArgumentException("Column " + name + " has "
                + (values == null ? "no" : String.valueOf(values.length)) + " values, table has " + rowCount + " rows");
        }
        columns.put(name, values);
        return this;
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /**
     * Live column array; stages write into it in place.
     *
     * @throws IllegalArgumentException if absent
     */
    public double[] column(String name) {
        double[] values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("No column named " + name);
        }
        return values;
    }

    public List<String> columnNames() {
        return Collections.unmodifiableList(new ArrayList<>(columns.keySet()));
    }

    public int columnCount() {
        return columns.size();
    }

    // ========== RAW TIMESTAMPS ==========

    public TimeSeriesTable withRawTimestamps(String name, List<String> values) {
        if (values == null || values.size() != rowCount) {
            throw new IllegalArgumentException("Timestamp column " + name + " must have " + rowCount + " values");
        }
        this.rawTimestampName = name;
        this.rawTimestamps = new ArrayList<>(values);
        return this;
    }

    public Optional<String> rawTimestampColumn() {
        return Optional.ofNullable(rawTimestampName);
    }

    public List<String> rawTimestamps() {
        return rawTimestamps == null ? List.of() : Collections.unmodifiableList(rawTimestamps);
    }

    // ========== TIME INDEX ==========

    /**
     * Re-key the table by timestamp. Rows are stably sorted ascending, so rows with equal
     * timestamps keep their original relative order. The raw timestamp column is consumed.
     */
    public void indexBy(String name, long[] epochNanos) {
        if (epochNanos == null || epochNanos.length != rowCount) {
            throw new IllegalArgumentException("Index must have " + rowCount + " entries");
        }
        Integer[] order = new Integer[rowCount];
        for (int i = 0; i < rowCount; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingLong(i -> epochNanos[i]));

        long[] sorted = new long[rowCount];
        for (int i = 0; i < rowCount; i++) {
            sorted[i] = epochNanos[order[i]];
        }
        for (Map.Entry<String, double[]> entry : columns.entrySet()) {
            double[] source = entry.getValue();
            double[] permuted = new double[rowCount];
            for (int i = 0; i < rowCount; i++) {
                permuted[i] = source[order[i]];
            }
            entry.setValue(permuted);
        }

        this.index = sorted;
        this.indexName = name;
        this.rawTimestampName = null;
        this.rawTimestamps = null;
    }

    public boolean isTimeIndexed() {
        return index != null;
    }

    public Optional<String> indexName() {
        return Optional.ofNullable(indexName);
    }

    /**
     * Copy of the epoch-nanosecond index, or null when the table is not time indexed.
     */
    public long[] index() {
        return index == null ? null : index.clone();
    }

    public Instant timestampAt(int row) {
        if (index == null) {
            throw new IllegalStateException("Table is not time indexed");
        }
        return toInstant(index[row]);
    }

    /**
     * Clock used by every time-windowed stage: the real index, or row position as whole
     * seconds when the table was never indexed.
     */
    public long[] windowClock() {
        if (index != null) {
            return index;
        }
        long[] synthetic = new long[rowCount];
        for (int i = 0; i < rowCount; i++) {
            synthetic[i] = i * FeatureConstants.NANOS_PER_SECOND;
        }
        return synthetic;
    }

    // ========== COPY ==========

    public TimeSeriesTable copy() {
        TimeSeriesTable copy = new TimeSeriesTable(rowCount);
        columns.forEach((name, values) -> copy.columns.put(name, values.clone()));
        copy.rawTimestampName = rawTimestampName;
        copy.rawTimestamps = rawTimestamps == null ? null : new ArrayList<>(rawTimestamps);
        copy.indexName = indexName;
        copy.index = index == null ? null : index.clone();
        return copy;
    }

    public static Instant toInstant(long epochNanos) {
        return Instant.ofEpochSecond(
            Math.floorDiv(epochNanos, FeatureConstants.NANOS_PER_SECOND),
            Math.floorMod(epochNanos, FeatureConstants.NANOS_PER_SECOND));
    }

    public static long toEpochNanos(Instant instant) {
        return Math.addExact(
            Math.multiplyExact(instant.getEpochSecond(), FeatureConstants.NANOS_PER_SECOND),
            instant.getNano());
    }

    @Override
    public String toString() {
        return "TimeSeriesTable{rows=" + rowCount + ", columns=" + columns.size()
            + ", indexed=" + isTimeIndexed() + "}";
    }
}
