package com.kotsin.nox.model;

import lombok.Value;

/**
 * A non-fatal data-quality condition met during a run.
 */
@Value
public class PreprocessingWarning {

    public enum Code {
        TIMESTAMP_COLUMN_MISSING,
        TIMESTAMP_UNPARSEABLE,
        WEIGHT_CHANNEL_MISSING,
        CHANNEL_MISSING,
        TARGET_MISSING,
        COLUMN_PRUNED
    }

    Code code;
    String column;
    String message;
}
