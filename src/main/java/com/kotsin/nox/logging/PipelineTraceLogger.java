package com.kotsin.nox.logging;

import com.kotsin.nox.model.PreprocessingWarning;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * PipelineTraceLogger - Unified logging for one preprocessing run
 *
 * Shows the complete flow:
 * INPUT → INDEX → TRASH → STATS → SPIKE → CURATE → OUTPUT
 *
 * Format: [STAGE] key=value | key=value
 */
@Slf4j
@Component
public class PipelineTraceLogger {

    private final boolean traceEnabled;

    public PipelineTraceLogger(@Value("${nox.trace.enabled:true}") boolean traceEnabled) {
        this.traceEnabled = traceEnabled;
    }

    /**
     * Stage 0: raw table received
     */
    public void logInput(int rows, int columns, boolean hasTimestamps) {
        if (!traceEnabled) return;
        log.info("┌─[INPUT] rows={} columns={} timestamps={}", rows, columns, hasTimestamps ? "✓" : "✗");
    }

    /**
     * Stages 1-5
     */
    public void logStage(String stage, Map<String, Object> metrics) {
        if (!traceEnabled) return;
        log.info("├─[{}] {}", stage, formatMetrics(metrics));
    }

    /**
     * Stage 6: matrix ready
     */
    public void logOutput(int rows, int features, Instant first, Instant last, List<PreprocessingWarning> warnings) {
        if (!traceEnabled) return;
        log.info("└─[OUTPUT] shape={}x{} span={}..{} warnings={}",
            rows, features, first == null ? "-" : first, last == null ? "-" : last, warnings.size());
    }

    public void logWarning(String stage, PreprocessingWarning warning) {
        if (!traceEnabled) return;
        log.warn("⚠️ [{}] {} | {} | {}", stage, warning.getCode(), warning.getColumn(), warning.getMessage());
    }

    public static Map<String, Object> metrics(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("metrics expects key/value pairs");
        }
        Map<String, Object> metrics = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            metrics.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return metrics;
    }

    /**
     * Format metrics for logging (key=value | key=value)
     */
    static String formatMetrics(Map<String, Object> metrics) {
        if (metrics == null || metrics.isEmpty()) {
            return "no_metrics";
        }

        StringBuilder sb = new StringBuilder();
        metrics.forEach((key, value) -> {
            if (sb.length() > 0) sb.append(" | ");

            if (value instanceof Double || value instanceof Float) {
                sb.append(String.format(Locale.ROOT, "%s=%.2f", key, ((Number) value).doubleValue()));
            } else if (value instanceof Integer || value instanceof Long) {
                sb.append(String.format(Locale.ROOT, "%s=%d", key, ((Number) value).longValue()));
            } else {
                sb.append(String.format(Locale.ROOT, "%s=%s", key, value));
            }
        });
        return sb.toString();
    }
}
