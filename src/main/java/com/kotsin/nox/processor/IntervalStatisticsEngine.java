package com.kotsin.nox.processor;

import com.kotsin.nox.calculator.ExactTimeLookback;
import com.kotsin.nox.calculator.SlidingWindowAggregator;
import com.kotsin.nox.config.FeatureConstants;
import com.kotsin.nox.config.PreprocessingConfig;
import com.kotsin.nox.model.FeatureColumn;
import com.kotsin.nox.model.PreprocessingContext;
import com.kotsin.nox.model.PreprocessingWarning;
import com.kotsin.nox.model.StatisticKind;
import com.kotsin.nox.model.TimeSeriesTable;
import com.kotsin.nox.util.MathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * IntervalStatisticsEngine - Trailing statistics per (channel, window).
 *
 * For every configured channel present in the table and every lookback window w:
 * - mean / std over the trailing window (t - w, t]
 * - mean_rate_change = (v[t] - v[t-w]) / v[t-w], zero denominator replaced by epsilon
 * - range_change = v[t] - v[t-w]
 * - momentum_max_up / momentum_max_down = max / min of the per-sample rate within the window
 * - max_increase_from_start / max_decrease_from_start = window max / min - v[t-w]
 *
 * v[t-w] comes from {@link ExactTimeLookback}: only a sample exactly w seconds earlier
 * counts, anything else is NaN.
 *
 * The per-sample rate is computed once per channel over the whole series and shared by
 * every window. Window bounds and lookback matches depend only on the clock and are
 * shared by every channel.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IntervalStatisticsEngine {

    private final PreprocessingConfig config;

    /**
     * @return generated columns in column order
     */
    public List<FeatureColumn> apply(PreprocessingContext context) {
        TimeSeriesTable table = context.table();
        PreprocessingConfig.IntervalStatsConfig stats = config.getIntervalStats();
        List<Integer> windows = stats.getWindowsSeconds();
        double epsilon = stats.getEpsilon();

        long[] clock = table.windowClock();
        Map<Integer, int[]> windowStarts = new LinkedHashMap<>();
        Map<Integer, int[]> lookbackRows = new LinkedHashMap<>();
        for (int window : windows) {
            long windowNanos = window * FeatureConstants.NANOS_PER_SECOND;
            windowStarts.put(window, SlidingWindowAggregator.timeWindowStarts(clock, windowNanos));
            lookbackRows.put(window, ExactTimeLookback.matchRows(clock, windowNanos));
        }

        List<FeatureColumn> generated = new ArrayList<>();
        for (String channel : stats.getChannels()) {
            if (!table.hasColumn(channel)) {
                log.warn("Channel {} missing, interval statistics skipped", channel);
                context.warn(PreprocessingWarning.Code.CHANNEL_MISSING, channel,
                    "no " + channel + " column, interval statistics skipped");
                continue;
            }
            log.debug("Computing interval statistics for {}", channel);

            double[] values = table.column(channel);
            double[] ratePerSecond = instantaneousRate(values, clock, epsilon);

            Map<Integer, Map<StatisticKind, double[]>> byWindow = new LinkedHashMap<>();
            for (FeatureColumn column : FeatureColumn.forChannel(channel, windows)) {
                Map<StatisticKind, double[]> columns = byWindow.computeIfAbsent(column.getWindowSeconds(),
                    window -> computeWindow(values, ratePerSecond,
                        windowStarts.get(window), lookbackRows.get(window), epsilon));
                table.putColumn(column.name(), columns.get(column.getKind()));
                generated.add(column);
            }
        }

        log.info("Interval statistics created: {} columns", generated.size());
        return generated;
    }

    static Map<StatisticKind, double[]> computeWindow(double[] values, double[] ratePerSecond,
                                                      int[] starts, int[] lookbackRows, double epsilon) {
        int rows = values.length;
        double[] startValue = ExactTimeLookback.valuesAt(values, lookbackRows);
        double[] windowMax = SlidingWindowAggregator.max(values, starts);
        double[] windowMin = SlidingWindowAggregator.min(values, starts);

        double[] rateChange = new double[rows];
        double[] rangeChange = new double[rows];
        double[] increase = new double[rows];
        double[] decrease = new double[rows];
        for (int i = 0; i < rows; i++) {
            rateChange[i] = MathUtils.rateOfChange(values[i], startValue[i], epsilon);
            rangeChange[i] = values[i] - startValue[i];
            increase[i] = windowMax[i] - startValue[i];
            decrease[i] = windowMin[i] - startValue[i];
        }

        Map<StatisticKind, double[]> columns = new EnumMap<>(StatisticKind.class);
        columns.put(StatisticKind.MEAN, SlidingWindowAggregator.mean(values, starts));
        columns.put(StatisticKind.STD, SlidingWindowAggregator.std(values, starts));
        columns.put(StatisticKind.MEAN_RATE_CHANGE, rateChange);
        columns.put(StatisticKind.RANGE_CHANGE, rangeChange);
        columns.put(StatisticKind.MOMENTUM_MAX_UP, SlidingWindowAggregator.max(ratePerSecond, starts));
        columns.put(StatisticKind.MOMENTUM_MAX_DOWN, SlidingWindowAggregator.min(ratePerSecond, starts));
        columns.put(StatisticKind.MAX_INCREASE_FROM_START, increase);
        columns.put(StatisticKind.MAX_DECREASE_FROM_START, decrease);
        return columns;
    }

    /**
     * (v[i] - v[i-1]) / elapsed seconds, zero elapsed time replaced by epsilon. Row 0 is NaN.
     */
    static double[] instantaneousRate(double[] values, long[] clock, double epsilon) {
        double[] delta = MathUtils.firstDifference(values);
        double[] rate = new double[values.length];
        if (values.length > 0) {
            rate[0] = Double.NaN;
        }
        for (int i = 1; i < values.length; i++) {
            double elapsedSeconds = (double) (clock[i] - clock[i - 1]) / FeatureConstants.NANOS_PER_SECOND;
            rate[i] = delta[i] / MathUtils.nonZero(elapsedSeconds, epsilon);
        }
        return rate;
    }
}
