package com.kotsin.nox.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything one pipeline run hands back to its caller.
 */
@Value
@Builder
public class PreprocessingResult {

    ModelInputMatrix matrix;

    CuratedFeatureList featureList;

    @Singular
    List<PreprocessingWarning> warnings;

    long spikeCount;

    long trashDropCount;

    public List<String> getFeatureColumns() {
        return featureList.getFeatures();
    }

    public double getSpikePercentage() {
        int rows = matrix.rowCount();
        return rows == 0 ? 0.0 : spikeCount * 100.0 / rows;
    }

    public boolean hasWarning(PreprocessingWarning.Code code) {
        return warnings.stream().anyMatch(w -> w.getCode() == code);
    }
}
