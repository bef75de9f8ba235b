package com.kotsin.nox.processor;

import com.kotsin.nox.calculator.SlidingWindowAggregator;
import com.kotsin.nox.config.FeatureConstants;
import com.kotsin.nox.config.PreprocessingConfig;
import com.kotsin.nox.model.PreprocessingContext;
import com.kotsin.nox.model.PreprocessingWarning;
import com.kotsin.nox.model.TimeSeriesTable;
import com.kotsin.nox.util.MathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * TrashDropDetector - Flags material-feed events from the crane weight channel.
 *
 * The crane reading falls sharply right after a load is dumped, so a drop shows up as a
 * large negative step in the running peak of the weight:
 * 1. forward-fill the weight
 * 2. running max over the last N samples (sample count, denoising)
 * 3. first difference of that max; below the threshold → trash_drop = 1
 * 4. trash_drop_count_30min = trailing sum of drops over the count window (time based)
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TrashDropDetector {

    private final PreprocessingConfig config;

    /**
     * @return number of rows flagged as a drop
     */
    public long apply(PreprocessingContext context) {
        TimeSeriesTable table = context.table();
        PreprocessingConfig.TrashDropConfig trash = config.getTrashDrop();
        String channel = trash.getWeightChannel();
        int rows = table.rowCount();

        if (!table.hasColumn(channel)) {
            log.warn("Weight channel {} missing, trash drop features set to 0", channel);
            context.warn(PreprocessingWarning.Code.WEIGHT_CHANNEL_MISSING, channel,
                "no " + channel + " column, " + FeatureConstants.TRASH_DROP + " defaults to 0");
            table.putColumn(FeatureConstants.TRASH_DROP, MathUtils.constant(rows, 0.0));
            table.putColumn(FeatureConstants.TRASH_DROP_COUNT_30MIN, MathUtils.constant(rows, 0.0));
            return 0;
        }

        double[] drops = detectDrops(table.column(channel), trash.getPeakWindowSamples(), trash.getDropThreshold());

        int[] starts = SlidingWindowAggregator.timeWindowStarts(table.windowClock(), trash.getCountWindow().toNanos());
        double[] counts = SlidingWindowAggregator.sum(drops, starts);
        for (int i = 0; i < counts.length; i++) {
            counts[i] = MathUtils.valueOrZero(counts[i]);
        }

        table.putColumn(FeatureConstants.TRASH_DROP, drops);
        table.putColumn(FeatureConstants.TRASH_DROP_COUNT_30MIN, counts);

        long dropCount = 0;
        for (double d : drops) {
            if (d == 1.0) dropCount++;
        }
        log.info("Trash drop features created: {} drops in {} rows", dropCount, rows);
        return dropCount;
    }

    /**
     * 1.0 where the first difference of the full-window running peak is below the threshold.
     */
    static double[] detectDrops(double[] weight, int peakWindowSamples, double dropThreshold) {
        double[] peak = SlidingWindowAggregator.fullCountWindowMax(MathUtils.forwardFill(weight), peakWindowSamples);
        double[] peakDiff = MathUtils.firstDifference(peak);
        double[] drops = new double[weight.length];
        for (int i = 0; i < drops.length; i++) {
            // NaN < threshold is false
            drops[i] = MathUtils.flag(peakDiff[i] < dropThreshold);
        }
        return drops;
    }
}
