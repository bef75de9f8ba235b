package com.kotsin.nox.service;

import com.kotsin.nox.model.AlignedFeatures;
import com.kotsin.nox.model.ModelInputMatrix;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * ModelFeatureAligner - Matches a produced feature matrix to the inputs a trained model expects.
 *
 * The curated feature list differs from run to run, so serving code aligns every batch:
 * features the model expects but the run pruned are filled with 0, features the model never
 * saw are dropped. Column order follows the model.
 */
@Service
@Slf4j
public class ModelFeatureAligner {

    public AlignedFeatures align(ModelInputMatrix produced, List<String> modelFeatures) {
        if (produced == null || modelFeatures == null) {
            throw new IllegalArgumentException("produced matrix and model features are required");
        }

        List<String> substituted = new ArrayList<>();
        for (String feature : modelFeatures) {
            if (!produced.hasFeature(feature)) {
                substituted.add(feature);
            }
        }
        Set<String> expected = new HashSet<>(modelFeatures);
        List<String> omitted = new ArrayList<>();
        for (String feature : produced.getFeatureNames()) {
            if (!expected.contains(feature)) {
                omitted.add(feature);
            }
        }

        int rows = produced.rowCount();
        double[][] aligned = new double[rows][modelFeatures.size()];
        for (int c = 0; c < modelFeatures.size(); c++) {
            String feature = modelFeatures.get(c);
            if (!produced.hasFeature(feature)) {
                continue;
            }
            double[] column = produced.column(feature);
            for (int r = 0; r < rows; r++) {
                aligned[r][c] = column[r];
            }
        }

        if (!substituted.isEmpty()) {
            log.warn("{} of {} model features not produced, filled with 0: {}",
                substituted.size(), modelFeatures.size(), preview(substituted));
        }
        if (!omitted.isEmpty()) {
            log.info("{} produced features unknown to the model were omitted", omitted.size());
        }

        return new AlignedFeatures(new ModelInputMatrix(produced.index(), modelFeatures, aligned), substituted, omitted);
    }

    private static String preview(List<String> names) {
        return names.size() <= 10 ? names.toString() : names.subList(0, 10) + " ... and " + (names.size() - 10) + " more";
    }
}
