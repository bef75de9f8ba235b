package com.kotsin.nox.model;

import lombok.Value;

import java.util.List;

/**
 * Feature matrix re-ordered to a model's expected inputs.
 */
@Value
public class AlignedFeatures {

    ModelInputMatrix matrix;

    /**
     * Expected by the model but not produced; zero-filled
     */
    List<String> substituted;

    /**
     * Produced but unknown to the model; dropped
     */
    List<String> omitted;

    public boolean isComplete() {
        return substituted.isEmpty();
    }
}
