package com.kotsin.nox.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fails fast on a preprocessing configuration that cannot produce a valid feature set.
 */
@Component
@Slf4j
public class PreprocessingConfigValidator {

    private final PreprocessingConfig config;
    private final Environment environment;

    public PreprocessingConfigValidator(PreprocessingConfig config, Environment environment) {
        this.config = config;
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateOnStartup() {
        if (environment.acceptsProfiles(Profiles.of("test"))) {
            log.info("Skipping preprocessing config validation in test mode");
            return;
        }
        validate();
    }

    /**
     * @throws IllegalStateException listing every violation
     */
    public void validate() {
        List<String> errors = collectErrors(config);
        if (!errors.isEmpty()) {
            errors.forEach(e -> log.error("   - {}", e));
            throw new IllegalStateException("Invalid nox.preprocessing configuration: " + String.join("; ", errors));
        }
        log.info("Preprocessing configuration valid: {} channels x {} windows",
            config.getIntervalStats().getChannels().size(),
            config.getIntervalStats().getWindowsSeconds().size());
    }

    static List<String> collectErrors(PreprocessingConfig config) {
        List<String> errors = new ArrayList<>();

        if (isNullOrEmpty(config.getTimestampColumn())) {
            errors.add("nox.preprocessing.timestamp-column is not configured");
        }
        if (isNullOrEmpty(config.getTargetColumn())) {
            errors.add("nox.preprocessing.target-column is not configured");
        }

        PreprocessingConfig.TrashDropConfig trash = config.getTrashDrop();
        if (isNullOrEmpty(trash.getWeightChannel())) {
            errors.add("nox.preprocessing.trash-drop.weight-channel is not configured");
        }
        if (trash.getPeakWindowSamples() < 2) {
            errors.add("nox.preprocessing.trash-drop.peak-window-samples must be at least 2");
        }
        if (!Double.isFinite(trash.getDropThreshold())) {
            errors.add("nox.preprocessing.trash-drop.drop-threshold must be finite");
        }
        if (trash.getCountWindow() == null || trash.getCountWindow().isNegative() || trash.getCountWindow().isZero()) {
            errors.add("nox.preprocessing.trash-drop.count-window must be positive");
        }

        PreprocessingConfig.IntervalStatsConfig stats = config.getIntervalStats();
        if (stats.getChannels() == null || stats.getChannels().isEmpty()) {
            errors.add("nox.preprocessing.interval-stats.channels is empty");
        }
        if (stats.getWindowsSeconds() == null || stats.getWindowsSeconds().isEmpty()) {
            errors.add("nox.preprocessing.interval-stats.windows-seconds is empty");
        } else {
            Set<Integer> seen = new HashSet<>();
            for (Integer window : stats.getWindowsSeconds()) {
                if (window == null || window <= 0) {
                    errors.add("nox.preprocessing.interval-stats.windows-seconds contains non-positive window " + window);
                } else if (!seen.add(window)) {
                    errors.add("nox.preprocessing.interval-stats.windows-seconds contains duplicate window " + window);
                }
            }
        }
        if (!(stats.getEpsilon() > 0) || !Double.isFinite(stats.getEpsilon())) {
            errors.add("nox.preprocessing.interval-stats.epsilon must be a small positive number");
        }

        PreprocessingConfig.SpikeConfig spike = config.getSpike();
        if (spike.getWindow() == null || spike.getWindow().isNegative() || spike.getWindow().isZero()) {
            errors.add("nox.preprocessing.spike.window must be positive");
        }
        if (!Double.isFinite(spike.getRangeThreshold()) || !Double.isFinite(spike.getStdThreshold())) {
            errors.add("nox.preprocessing.spike thresholds must be finite");
        }

        if (config.getCuration().getMaxMissingCount() < 0) {
            errors.add("nox.preprocessing.curation.max-missing-count must not be negative");
        }
        return errors;
    }

    private static boolean isNullOrEmpty(String value) {
        return value == null || value.trim().isEmpty();
    }
}
