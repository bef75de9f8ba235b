package com.kotsin.nox.infrastructure.json;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.nox.config.PreprocessingConfig;
import com.kotsin.nox.model.TimeSeriesTable;
import com.kotsin.nox.util.MathUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * TimeSeriesTableReader - Builds a {@link TimeSeriesTable} from the point records the
 * time-series store returns: a JSON array with one object per timestamp.
 *
 * - field names are lower-cased (the store reports upper-case channel names)
 * - a {@code time} field becomes the configured timestamp column
 * - finite numbers and numeric strings are read as doubles, booleans as 1/0, anything else
 *   (including NaN and Infinity) is missing
 * - a null record is rejected
 * - a field absent from a record is missing for that row
 */
@Component
@Slf4j
public class TimeSeriesTableReader {

    private static final String STORE_TIME_FIELD = "time";

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final TypeReference<List<Map<String, Object>>> RECORDS = new TypeReference<>() {};

    private final String timestampColumn;

    public TimeSeriesTableReader(PreprocessingConfig config) {
        this.timestampColumn = config.getTimestampColumn();
    }

    public TimeSeriesTable read(InputStream json) throws IOException {
        return fromJson(MAPPER.readTree(json));
    }

    public TimeSeriesTable read(String json) throws IOException {
        return fromJson(MAPPER.readTree(json));
    }

    private TimeSeriesTable fromJson(JsonNode root) {
        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException("Expected a JSON array of records, got "
                + (root == null ? "nothing" : root.getNodeType()));
        }
        return fromRecords(MAPPER.convertValue(root, RECORDS));
    }

    public TimeSeriesTable fromRecords(List<Map<String, Object>> records) {
        int rows = records.size();
        Map<String, double[]> columns = new LinkedHashMap<>();
        List<String> timestamps = new ArrayList<>(rows);
        boolean sawTimestamp = false;

        for (int r = 0; r < rows; r++) {
            Map<String, Object> record = records.get(r);
            if (record == null) {
                throw new IllegalArgumentException("Record " + r + " is null, expected a JSON object");
            }
            String timestamp = null;
            for (Map.Entry<String, Object> field : record.entrySet()) {
                String name = normalize(field.getKey());
                if (name.equals(timestampColumn)) {
                    timestamp = field.getValue() == null ? null : field.getValue().toString();
                    sawTimestamp = true;
                    continue;
                }
                double[] column = columns.computeIfAbsent(name, k -> missingColumn(rows));
                column[r] = toDouble(field.getValue());
            }
            timestamps.add(timestamp);
        }

        TimeSeriesTable table = new TimeSeriesTable(rows);
        columns.forEach(table::putColumn);
        if (sawTimestamp) {
            table.withRawTimestamps(timestampColumn, timestamps);
        }
        log.info("Read {} records with {} channels (timestamps: {})", rows, columns.size(), sawTimestamp);
        return table;
    }

    private String normalize(String field) {
        String name = field.toLowerCase(Locale.ROOT);
        return STORE_TIME_FIELD.equals(name) ? timestampColumn : name;
    }

    static double toDouble(Object value) {
        if (value instanceof Number) {
            return MathUtils.finiteOrMissing(((Number) value).doubleValue());
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? 1.0 : 0.0;
        }
        if (value instanceof String) {
            try {
                return MathUtils.finiteOrMissing(Double.parseDouble(((String) value).trim()));
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }

    private static double[] missingColumn(int rows) {
        double[] column = new double[rows];
        Arrays.fill(column, Double.NaN);
        return column;
    }
}
