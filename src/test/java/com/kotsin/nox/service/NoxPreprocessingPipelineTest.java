package com.kotsin.nox.service;

import com.kotsin.nox.config.FeatureConstants;
import com.kotsin.nox.config.PreprocessingConfig;
import com.kotsin.nox.fixtures.SyntheticTables;
import com.kotsin.nox.infrastructure.json.FeatureMatrixWriter;
import com.kotsin.nox.model.ModelInputMatrix;
import com.kotsin.nox.model.PreprocessingResult;
import com.kotsin.nox.model.PreprocessingWarning;
import com.kotsin.nox.model.TimeSeriesTable;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NoxPreprocessingPipeline - End to end")
class NoxPreprocessingPipelineTest {

    private static final int DROP_ROW = 3600;
    private static final int STEP_ROW = 5000;

    private static NoxPreprocessingPipeline pipeline;
    private static PreprocessingResult scenario;

    @BeforeAll
    static void runScenario() {
        pipeline = NoxPreprocessingPipeline.create(new PreprocessingConfig());
        scenario = pipeline.process(SyntheticTables.twoHourScenario(DROP_ROW, STEP_ROW));
    }

    @Test
    @DisplayName("Two hour scenario: shape and feature order")
    void testShapeAndOrder() {
        ModelInputMatrix matrix = scenario.getMatrix();
        List<String> features = scenario.getFeatureColumns();

        assertEquals(7200, matrix.rowCount());
        // is_spike + 4 channels present (o2, weight, two trash columns) + 4 x 5 x 8 statistics
        assertEquals(1 + 4 + 160, features.size());
        assertEquals(FeatureConstants.IS_SPIKE, features.get(0));
        assertEquals(List.of("br1_eo_o2_a", FeatureConstants.WEIGHT_CHANNEL,
            FeatureConstants.TRASH_DROP, FeatureConstants.TRASH_DROP_COUNT_30MIN), features.subList(1, 5));
        assertEquals("br1_eo_o2_a_mean_60s", features.get(5));
        assertEquals("trash_drop_count_30min_max_decrease_from_start_1800s", features.get(features.size() - 1));
        assertFalse(features.contains(FeatureConstants.TARGET_COLUMN));
        assertFalse(features.contains(FeatureConstants.NOX_RANGE_1MIN));
        assertTrue(scenario.getFeatureList().getPruned().isEmpty());
    }

    @Test
    @DisplayName("Two hour scenario: one trash drop, 59 spike rows")
    void testEvents() {
        ModelInputMatrix matrix = scenario.getMatrix();

        assertEquals(1, scenario.getTrashDropCount());
        assertEquals(1.0, matrix.value(DROP_ROW + 9, FeatureConstants.TRASH_DROP));
        assertEquals(1.0, matrix.value(DROP_ROW + 9 + 1799, FeatureConstants.TRASH_DROP_COUNT_30MIN));
        assertEquals(0.0, matrix.value(DROP_ROW + 9 + 1800, FeatureConstants.TRASH_DROP_COUNT_30MIN));

        assertEquals(59, scenario.getSpikeCount());
        assertEquals(59 * 100.0 / 7200, scenario.getSpikePercentage(), 1e-12);
        assertEquals(1.0, matrix.value(STEP_ROW, FeatureConstants.IS_SPIKE));
        assertEquals(0.0, matrix.value(STEP_ROW + 59, FeatureConstants.IS_SPIKE));
    }

    @Test
    @DisplayName("Two hour scenario: a full sine period averages to its offset")
    void testStatisticsValues() {
        ModelInputMatrix matrix = scenario.getMatrix();

        assertEquals(8.0, matrix.value(3000, "br1_eo_o2_a_mean_600s"), 1e-9);
        assertEquals(-100.0, matrix.value(DROP_ROW, FeatureConstants.WEIGHT_CHANNEL + "_range_change_60s"), 1e-12);
        assertEquals(-0.2, matrix.value(DROP_ROW, FeatureConstants.WEIGHT_CHANNEL + "_mean_rate_change_60s"), 1e-12);
        // lookback rows before the first full window are zero-filled
        assertEquals(0.0, matrix.value(10, "br1_eo_o2_a_range_change_60s"));
    }

    @Test
    @DisplayName("Two hour scenario: no NaN or infinity reaches the matrix")
    void testMatrixFinite() {
        ModelInputMatrix matrix = scenario.getMatrix();
        for (int r = 0; r < matrix.rowCount(); r++) {
            for (double v : matrix.row(r)) {
                assertTrue(Double.isFinite(v), "row " + r);
            }
        }
        assertTrue(matrix.hasIndex());
        assertEquals(SyntheticTables.START, matrix.timestampAt(0));
    }

    @Test
    @DisplayName("Two hour scenario: 13 absent channels are reported")
    void testChannelWarnings() {
        long missing = scenario.getWarnings().stream()
            .filter(w -> w.getCode() == PreprocessingWarning.Code.CHANNEL_MISSING)
            .count();

        assertEquals(13, missing);
        assertFalse(scenario.hasWarning(PreprocessingWarning.Code.TIMESTAMP_COLUMN_MISSING));
        assertFalse(scenario.hasWarning(PreprocessingWarning.Code.WEIGHT_CHANNEL_MISSING));
    }

    @Test
    @DisplayName("Same input twice: identical matrix and identical JSON")
    void testIdempotent() {
        TimeSeriesTable raw = SyntheticTables.twoHourScenario(DROP_ROW, STEP_ROW);
        PreprocessingResult first = pipeline.process(raw);
        PreprocessingResult second = pipeline.process(raw);

        assertEquals(first.getFeatureColumns(), second.getFeatureColumns());
        for (int r = 0; r < first.getMatrix().rowCount(); r++) {
            assertArrayEquals(first.getMatrix().row(r), second.getMatrix().row(r), 0.0);
        }
        FeatureMatrixWriter writer = new FeatureMatrixWriter();
        assertEquals(writer.toJson(first), writer.toJson(second));
    }

    @Test
    @DisplayName("Input table is not modified")
    void testInputUntouched() {
        TimeSeriesTable raw = SyntheticTables.twoHourScenario(DROP_ROW, STEP_ROW);
        List<String> columnsBefore = raw.columnNames();
        double[] weightBefore = raw.column(FeatureConstants.WEIGHT_CHANNEL).clone();

        pipeline.process(raw);

        assertEquals(columnsBefore, raw.columnNames());
        assertArrayEquals(weightBefore, raw.column(FeatureConstants.WEIGHT_CHANNEL));
        assertFalse(raw.isTimeIndexed());
    }

    @Test
    @DisplayName("Out-of-order rows are sorted by time before windowing")
    void testUnsortedInput() {
        List<String> timestamps = new ArrayList<>(SyntheticTables.secondly(3));
        TimeSeriesTable raw = new TimeSeriesTable(3)
            .withRawTimestamps(FeatureConstants.TIMESTAMP_COLUMN,
                List.of(timestamps.get(2), timestamps.get(0), timestamps.get(1)))
            .putColumn(FeatureConstants.WEIGHT_CHANNEL, new double[]{3, 1, 2});

        ModelInputMatrix matrix = pipeline.process(raw).getMatrix();

        assertEquals(SyntheticTables.START, matrix.timestampAt(0));
        assertArrayEquals(new double[]{1, 2, 3}, matrix.column(FeatureConstants.WEIGHT_CHANNEL));
    }

    @Test
    @DisplayName("No timestamp column: degraded run on row positions with a warning")
    void testDegradedMode() {
        TimeSeriesTable raw = new TimeSeriesTable(120)
            .putColumn(FeatureConstants.WEIGHT_CHANNEL, SyntheticTables.series(120, i -> i))
            .putColumn(FeatureConstants.TARGET_COLUMN, SyntheticTables.series(120, i -> 50.0));

        PreprocessingResult result = pipeline.process(raw);

        assertTrue(result.hasWarning(PreprocessingWarning.Code.TIMESTAMP_COLUMN_MISSING));
        assertFalse(result.getMatrix().hasIndex());
        assertEquals(120, result.getMatrix().rowCount());
        assertEquals(60.0, result.getMatrix().value(119, FeatureConstants.WEIGHT_CHANNEL + "_range_change_60s"), 1e-12);
    }

    @Test
    @DisplayName("Unparseable timestamp: warning and degraded run, no exception")
    void testUnparseableTimestamps() {
        TimeSeriesTable raw = new TimeSeriesTable(2)
            .withRawTimestamps(FeatureConstants.TIMESTAMP_COLUMN, Arrays.asList("2025-07-01T00:00:00Z", "soon"))
            .putColumn(FeatureConstants.WEIGHT_CHANNEL, new double[]{1, 2});

        PreprocessingResult result = pipeline.process(raw);

        assertTrue(result.hasWarning(PreprocessingWarning.Code.TIMESTAMP_UNPARSEABLE));
        assertFalse(result.getMatrix().hasIndex());
    }

    @Test
    @DisplayName("Table with no columns: every stage warns, nothing throws")
    void testNoColumns() {
        PreprocessingResult result = pipeline.process(new TimeSeriesTable(5));

        assertTrue(result.hasWarning(PreprocessingWarning.Code.WEIGHT_CHANNEL_MISSING));
        assertTrue(result.hasWarning(PreprocessingWarning.Code.TARGET_MISSING));
        assertEquals(5, result.getMatrix().rowCount());
        assertEquals(0.0, result.getMatrix().value(4, FeatureConstants.IS_SPIKE));
        assertEquals(0, result.getSpikeCount());
    }

    @Test
    @DisplayName("Zero rows in, zero rows out")
    void testEmptyTable() {
        TimeSeriesTable raw = new TimeSeriesTable(0)
            .withRawTimestamps(FeatureConstants.TIMESTAMP_COLUMN, List.of())
            .putColumn(FeatureConstants.WEIGHT_CHANNEL, new double[0]);

        PreprocessingResult result = pipeline.process(raw);

        assertEquals(0, result.getMatrix().rowCount());
        assertEquals(0.0, result.getSpikePercentage());
    }

    @Test
    @DisplayName("Null input is rejected")
    void testNullInput() {
        assertThrows(IllegalArgumentException.class, () -> pipeline.process(null));
    }

    @Test
    @DisplayName("One instance serves concurrent runs with different inputs")
    void testConcurrentRuns() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<PreprocessingResult>> futures = new ArrayList<>();
            for (int k = 0; k < 4; k++) {
                int step = 1000 + k * 1000;
                futures.add(executor.submit(() -> pipeline.process(SyntheticTables.twoHourScenario(DROP_ROW, step))));
            }
            for (int k = 0; k < 4; k++) {
                PreprocessingResult result = futures.get(k).get();
                int step = 1000 + k * 1000;
                assertEquals(59, result.getSpikeCount());
                assertEquals(1.0, result.getMatrix().value(step, FeatureConstants.IS_SPIKE));
                assertEquals(0.0, result.getMatrix().value(step - 1, FeatureConstants.IS_SPIKE));
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
