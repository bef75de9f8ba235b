package com.kotsin.nox.processor;

import com.kotsin.nox.config.FeatureConstants;
import com.kotsin.nox.config.PreprocessingConfig;
import com.kotsin.nox.model.CuratedFeatureList;
import com.kotsin.nox.model.FeatureColumn;
import com.kotsin.nox.model.PreprocessingContext;
import com.kotsin.nox.model.PreprocessingWarning;
import com.kotsin.nox.model.TimeSeriesTable;
import com.kotsin.nox.util.MathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * FeatureCurator - Candidate assembly and missing-value pruning.
 *
 * Candidates: is_spike, then the raw channels, then the generated interval statistics.
 * Columns missing from the table are not candidates. A candidate with more missing values
 * than the configured absolute count is pruned.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FeatureCurator {

    private final PreprocessingConfig config;

    public List<String> candidates(TimeSeriesTable table, List<FeatureColumn> generated) {
        Set<String> candidates = new LinkedHashSet<>();
        candidates.add(FeatureConstants.IS_SPIKE);
        candidates.addAll(config.getIntervalStats().getChannels());
        for (FeatureColumn column : generated) {
            candidates.add(column.name());
        }
        candidates.removeIf(name -> !table.hasColumn(name));
        return new ArrayList<>(candidates);
    }

    public CuratedFeatureList curate(PreprocessingContext context, List<String> candidates) {
        TimeSeriesTable table = context.table();
        long maxMissing = config.getCuration().getMaxMissingCount();

        List<String> kept = new ArrayList<>(candidates.size());
        List<String> pruned = new ArrayList<>();
        for (String name : candidates) {
            long missing = MathUtils.countMissing(table.column(name));
            if (missing > maxMissing) {
                pruned.add(name);
                context.warn(PreprocessingWarning.Code.COLUMN_PRUNED, name,
                    missing + " missing values exceed " + maxMissing);
            } else {
                kept.add(name);
            }
        }

        log.info("Final feature count: {}", kept.size());
        if (!pruned.isEmpty()) {
            log.warn("Pruned {} features with more than {} missing values", pruned.size(), maxMissing);
        }
        return new CuratedFeatureList(kept, pruned);
    }
}
