package com.kotsin.nox.processor;

import com.kotsin.nox.model.CuratedFeatureList;
import com.kotsin.nox.model.ModelInputMatrix;
import com.kotsin.nox.model.TimeSeriesTable;
import com.kotsin.nox.util.MathUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * ModelInputBuilder - Projects the table onto the curated features and zero-fills gaps.
 *
 * Rows are never dropped so the matrix stays aligned with the input timestamps.
 * NaN and infinite values both become 0.
 */
@Component
@Slf4j
public class ModelInputBuilder {

    public ModelInputMatrix build(TimeSeriesTable table, CuratedFeatureList featureList) {
        List<String> features = featureList.getFeatures();
        int rows = table.rowCount();
        double[][] matrix = new double[rows][features.size()];

        long filled = 0;
        for (int c = 0; c < features.size(); c++) {
            double[] column = table.column(features.get(c));
            for (int r = 0; r < rows; r++) {
                double value = MathUtils.finiteOrMissing(column[r]);
                if (MathUtils.isMissing(value)) filled++;
                matrix[r][c] = MathUtils.valueOrZero(value);
            }
        }

        log.info("Model input ready: {} rows x {} features, {} missing values filled with 0",
            rows, features.size(), filled);
        return new ModelInputMatrix(table.index(), features, matrix);
    }
}
