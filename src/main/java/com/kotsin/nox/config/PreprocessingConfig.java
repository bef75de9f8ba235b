package com.kotsin.nox.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Externalized thresholds and windows for the NOx preprocessing pipeline.
 * Defaults reproduce {@link FeatureConstants}.
 */
@Configuration
@ConfigurationProperties(prefix = "nox.preprocessing")
@Data
public class PreprocessingConfig {

    /**
     * Name of the raw timestamp column in the acquired table
     */
    private String timestampColumn = FeatureConstants.TIMESTAMP_COLUMN;

    /**
     * Name of the emission target channel used for spike detection
     */
    private String targetColumn = FeatureConstants.TARGET_COLUMN;

    private TrashDropConfig trashDrop = new TrashDropConfig();

    private IntervalStatsConfig intervalStats = new IntervalStatsConfig();

    private SpikeConfig spike = new SpikeConfig();

    private CurationConfig curation = new CurationConfig();

    @Data
    public static class TrashDropConfig {
        /**
         * Crane weight channel
         */
        private String weightChannel = FeatureConstants.WEIGHT_CHANNEL;

        /**
         * Sample-count window for the running peak
         */
        private int peakWindowSamples = FeatureConstants.TRASH_PEAK_WINDOW_SAMPLES;

        /**
         * A first difference of the running peak below this flags a drop
         */
        private double dropThreshold = FeatureConstants.TRASH_DROP_THRESHOLD;

        /**
         * Time window for the drop counter
         */
        private Duration countWindow = FeatureConstants.TRASH_COUNT_WINDOW;
    }

    @Data
    public static class IntervalStatsConfig {
        private List<String> channels = new ArrayList<>(FeatureConstants.DEFAULT_CHANNELS);

        private List<Integer> windowsSeconds = new ArrayList<>(FeatureConstants.DEFAULT_WINDOWS_SECONDS);

        /**
         * Substitute for zero denominators
         */
        private double epsilon = FeatureConstants.EPSILON;
    }

    @Data
    public static class SpikeConfig {
        private Duration window = FeatureConstants.SPIKE_WINDOW;

        /**
         * Range must be strictly above this
         */
        private double rangeThreshold = FeatureConstants.SPIKE_RANGE_THRESHOLD;

        /**
         * Std must be strictly below this
         */
        private double stdThreshold = FeatureConstants.SPIKE_STD_THRESHOLD;
    }

    @Data
    public static class CurationConfig {
        /**
         * Absolute number of missing values a column may have before it is pruned
         */
        private long maxMissingCount = FeatureConstants.MAX_MISSING_COUNT;
    }
}
