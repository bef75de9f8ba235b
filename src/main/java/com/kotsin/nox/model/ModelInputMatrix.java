package com.kotsin.nox.model;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * ModelInputMatrix - Final row-major feature matrix handed to the regression model.
 *
 * Rows align one-to-one with the indexed input rows. No value is NaN.
 */
public final class ModelInputMatrix {

    private final long[] index;
    private final List<String> featureNames;
    private final double[][] rows;
    private final Map<String, Integer> positions = new HashMap<>();

    /**
     * @param index epoch-nanosecond timestamps per row, or null when the input had none
     */
    public ModelInputMatrix(long[] index, List<String> featureNames, double[][] rows) {
        if (index != null && index.length != rows.length) {
            throw new IllegalArgumentException("Index has " + index.length + " entries for " + rows.length + " rows");
        }
        this.index = index == null ? null : index.clone();
        this.featureNames = List.copyOf(featureNames);
        this.rows = rows;
        for (int c = 0; c < this.featureNames.size(); c++) {
            positions.put(this.featureNames.get(c), c);
        }
    }

    public int rowCount() {
        return rows.length;
    }

    public int columnCount() {
        return featureNames.size();
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }

    public boolean hasIndex() {
        return index != null;
    }

    public Instant timestampAt(int row) {
        if (index == null) {
            throw new IllegalStateException("Matrix has no time index");
        }
        return TimeSeriesTable.toInstant(index[row]);
    }

    public long[] index() {
        return index == null ? null : index.clone();
    }

    public double value(int row, String feature) {
        return rows[row][position(feature)];
    }

    public double[] row(int row) {
        return rows[row].clone();
    }

    public double[] column(String feature) {
        int c = position(feature);
        double[] column = new double[rows.length];
        for (int r = 0; r < rows.length; r++) {
            column[r] = rows[r][c];
        }
        return column;
    }

    public boolean hasFeature(String feature) {
        return positions.containsKey(feature);
    }

    private int position(String feature) {
        Integer c = positions.get(feature);
        if (c == null) {
            throw new IllegalArgumentException("Unknown feature " + feature);
        }
        return c;
    }
}
