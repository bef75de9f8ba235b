package com.kotsin.nox.infrastructure.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.nox.model.ModelInputMatrix;
import com.kotsin.nox.model.PreprocessingResult;
import com.kotsin.nox.model.PreprocessingWarning;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * FeatureMatrixWriter - JSON serde for {@link FeatureMatrixPayload}.
 */
@Component
public class FeatureMatrixWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public FeatureMatrixPayload toPayload(PreprocessingResult result) {
        ModelInputMatrix matrix = result.getMatrix();

        double[][] rows = new double[matrix.rowCount()][];
        for (int r = 0; r < rows.length; r++) {
            rows[r] = matrix.row(r);
        }

        List<String> timestamps = null;
        if (matrix.hasIndex()) {
            timestamps = new ArrayList<>(matrix.rowCount());
            for (int r = 0; r < matrix.rowCount(); r++) {
                timestamps.add(matrix.timestampAt(r).toString());
            }
        }

        List<FeatureMatrixPayload.Warning> warnings = new ArrayList<>();
        for (PreprocessingWarning w : result.getWarnings()) {
            warnings.add(new FeatureMatrixPayload.Warning(w.getCode().name(), w.getColumn(), w.getMessage()));
        }

        return FeatureMatrixPayload.builder()
            .features(matrix.getFeatureNames())
            .timestamps(timestamps)
            .rows(rows)
            .warnings(warnings)
            .spikeCount(result.getSpikeCount())
            .trashDropCount(result.getTrashDropCount())
            .build();
    }

    public String toJson(PreprocessingResult result) {
        try {
            return MAPPER.writeValueAsString(toPayload(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Serialization failed for feature matrix", e);
        }
    }

    public void write(PreprocessingResult result, OutputStream out) throws IOException {
        MAPPER.writeValue(out, toPayload(result));
    }

    public FeatureMatrixPayload parse(String json) throws IOException {
        return MAPPER.readValue(json, FeatureMatrixPayload.class);
    }
}
