package com.kotsin.nox.service;

import com.kotsin.nox.config.PreprocessingConfig;
import com.kotsin.nox.logging.PipelineTraceLogger;
import com.kotsin.nox.model.CuratedFeatureList;
import com.kotsin.nox.model.FeatureColumn;
import com.kotsin.nox.model.ModelInputMatrix;
import com.kotsin.nox.model.PreprocessingContext;
import com.kotsin.nox.model.PreprocessingResult;
import com.kotsin.nox.model.PreprocessingWarning;
import com.kotsin.nox.model.TimeSeriesTable;
import com.kotsin.nox.processor.FeatureCurator;
import com.kotsin.nox.processor.IntervalStatisticsEngine;
import com.kotsin.nox.processor.ModelInputBuilder;
import com.kotsin.nox.processor.SpikeDetector;
import com.kotsin.nox.processor.TimeIndexer;
import com.kotsin.nox.processor.TrashDropDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

import static com.kotsin.nox.logging.PipelineTraceLogger.metrics;

/**
 * NoxPreprocessingPipeline - Raw sensor table in, model-ready feature matrix out.
 *
 * Stages run strictly in order, each adding columns to a private copy of the input:
 * TimeIndexer → TrashDropDetector → IntervalStatisticsEngine → SpikeDetector
 * → FeatureCurator → ModelInputBuilder
 *
 * No run state is stored on the pipeline; the curated feature list travels in the
 * returned {@link PreprocessingResult}, so one instance serves concurrent runs.
 * Data problems never throw: they come back as {@link PreprocessingWarning}s.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NoxPreprocessingPipeline {

    private final TimeIndexer timeIndexer;
    private final TrashDropDetector trashDropDetector;
    private final IntervalStatisticsEngine intervalStatisticsEngine;
    private final SpikeDetector spikeDetector;
    private final FeatureCurator featureCurator;
    private final ModelInputBuilder modelInputBuilder;
    private final PipelineTraceLogger trace;

    /**
     * Pipeline wired outside a Spring context.
     */
    public static NoxPreprocessingPipeline create(PreprocessingConfig config) {
        return new NoxPreprocessingPipeline(
            new TimeIndexer(config),
            new TrashDropDetector(config),
            new IntervalStatisticsEngine(config),
            new SpikeDetector(config),
            new FeatureCurator(config),
            new ModelInputBuilder(),
            new PipelineTraceLogger(true));
    }

    /**
     * @param raw acquired table; it is copied, never modified
     * @throws IllegalArgumentException if raw is null
     */
    public PreprocessingResult process(TimeSeriesTable raw) {
        if (raw == null) {
            throw new IllegalArgumentException("raw table must not be null");
        }
        trace.logInput(raw.rowCount(), raw.columnCount(), raw.rawTimestampColumn().isPresent());

        PreprocessingContext context = new PreprocessingContext(raw.copy());
        TimeSeriesTable table = context.table();

        boolean indexed = timeIndexer.apply(context);
        trace.logStage("INDEX", metrics("indexed", indexed, "rows", table.rowCount()));

        long trashDrops = trashDropDetector.apply(context);
        trace.logStage("TRASH", metrics("drops", trashDrops));

        List<FeatureColumn> generated = intervalStatisticsEngine.apply(context);
        trace.logStage("STATS", metrics("columns", generated.size()));

        long spikes = spikeDetector.apply(context);
        trace.logStage("SPIKE", metrics("spikes", spikes));

        List<String> candidates = featureCurator.candidates(table, generated);
        CuratedFeatureList featureList = featureCurator.curate(context, candidates);
        trace.logStage("CURATE", metrics("candidates", candidates.size(),
            "kept", featureList.size(), "pruned", featureList.getPruned().size()));

        ModelInputMatrix matrix = modelInputBuilder.build(table, featureList);

        List<PreprocessingWarning> warnings = context.warnings();
        warnings.forEach(w -> trace.logWarning("PREPROCESS", w));
        trace.logOutput(matrix.rowCount(), matrix.columnCount(), first(matrix), last(matrix), warnings);

        return PreprocessingResult.builder()
            .matrix(matrix)
            .featureList(featureList)
            .warnings(warnings)
            .spikeCount(spikes)
            .trashDropCount(trashDrops)
            .build();
    }

    private static Instant first(ModelInputMatrix matrix) {
        return matrix.hasIndex() && matrix.rowCount() > 0 ? matrix.timestampAt(0) : null;
    }

    private static Instant last(ModelInputMatrix matrix) {
        return matrix.hasIndex() && matrix.rowCount() > 0 ? matrix.timestampAt(matrix.rowCount() - 1) : null;
    }
}
