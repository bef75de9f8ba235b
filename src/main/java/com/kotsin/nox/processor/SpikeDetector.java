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

import java.util.Locale;

/**
 * SpikeDetector - Flags short step-changes in the NOx target.
 *
 * Over the trailing spike window: a range strictly above the range threshold together with
 * a std strictly below the std threshold. Large range with low variance is a fast sustained
 * step rather than high-frequency noise.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SpikeDetector {

    private final PreprocessingConfig config;

    /**
     * @return number of rows flagged as spike
     */
    public long apply(PreprocessingContext context) {
        TimeSeriesTable table = context.table();
        PreprocessingConfig.SpikeConfig spike = config.getSpike();
        String target = config.getTargetColumn();
        int rows = table.rowCount();

        if (!table.hasColumn(target)) {
            log.warn("Target {} missing, spike features set to 0", target);
            context.warn(PreprocessingWarning.Code.TARGET_MISSING, target,
                "no " + target + " column, " + FeatureConstants.IS_SPIKE + " defaults to 0");
            table.putColumn(FeatureConstants.NOX_RANGE_1MIN, MathUtils.constant(rows, 0.0));
            table.putColumn(FeatureConstants.NOX_STD_1MIN, MathUtils.constant(rows, 0.0));
            table.putColumn(FeatureConstants.IS_SPIKE, MathUtils.constant(rows, 0.0));
            return 0;
        }

        double[] values = table.column(target);
        int[] starts = SlidingWindowAggregator.timeWindowStarts(table.windowClock(), spike.getWindow().toNanos());
        double[] max = SlidingWindowAggregator.max(values, starts);
        double[] min = SlidingWindowAggregator.min(values, starts);
        double[] std = SlidingWindowAggregator.std(values, starts);

        double[] range = new double[rows];
        double[] isSpike = new double[rows];
        long spikeCount = 0;
        for (int i = 0; i < rows; i++) {
            range[i] = max[i] - min[i];
            boolean flagged = range[i] > spike.getRangeThreshold() && std[i] < spike.getStdThreshold();
            isSpike[i] = MathUtils.flag(flagged);
            if (flagged) spikeCount++;
        }

        table.putColumn(FeatureConstants.NOX_RANGE_1MIN, range);
        table.putColumn(FeatureConstants.NOX_STD_1MIN, std);
        table.putColumn(FeatureConstants.IS_SPIKE, isSpike);

        log.info("Spike rows detected: {} ({}%)", spikeCount,
            String.format(Locale.ROOT, "%.2f", rows == 0 ? 0.0 : spikeCount * 100.0 / rows));
        return spikeCount;
    }
}
