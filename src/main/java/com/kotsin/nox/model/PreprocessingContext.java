package com.kotsin.nox.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-run state threaded through the pipeline stages: the working table and the warnings
 * raised so far. Created for one run and discarded with it.
 */
public final class PreprocessingContext {

    private final TimeSeriesTable table;
    private final List<PreprocessingWarning> warnings = new ArrayList<>();

    public PreprocessingContext(TimeSeriesTable table) {
        if (table == null) {
            throw new IllegalArgumentException("table must not be null");
        }
        this.table = table;
    }

    public TimeSeriesTable table() {
        return table;
    }

    public void warn(PreprocessingWarning.Code code, String column, String message) {
        warnings.add(new PreprocessingWarning(code, column, message));
    }

    public List<PreprocessingWarning> warnings() {
        return Collections.unmodifiableList(warnings);
    }
}
