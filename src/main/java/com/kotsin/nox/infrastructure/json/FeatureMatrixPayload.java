package com.kotsin.nox.infrastructure.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Wire form of a preprocessing result for the model-serving side.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FeatureMatrixPayload {

    private List<String> features;

    /**
     * ISO-8601 instants, absent when the input had no timestamps
     */
    private List<String> timestamps;

    private double[][] rows;

    private List<Warning> warnings;

    private long spikeCount;

    private long trashDropCount;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Warning {
        private String code;
        private String column;
        private String message;
    }
}
