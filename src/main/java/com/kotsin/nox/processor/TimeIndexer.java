package com.kotsin.nox.processor;

import com.kotsin.nox.config.PreprocessingConfig;
import com.kotsin.nox.model.PreprocessingContext;
import com.kotsin.nox.model.PreprocessingWarning;
import com.kotsin.nox.model.TimeSeriesTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.List;

/**
 * TimeIndexer - Re-keys the raw table by its timestamp column.
 *
 * Accepted forms: ISO-8601 with 'T' or a space between date and time, optional fraction,
 * optional offset ("Z", "+09:00"). Timestamps without an offset are read as UTC.
 *
 * Without a usable timestamp column the table is left as is and downstream window stages
 * fall back to the row-position clock.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TimeIndexer {

    static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart().appendLiteral('T').optionalEnd()
        .optionalStart().appendLiteral(' ').optionalEnd()
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .optionalStart().appendOffsetId().optionalEnd()
        .toFormatter();

    private final PreprocessingConfig config;

    /**
     * @return true when the table is time indexed afterwards
     */
    public boolean apply(PreprocessingContext context) {
        TimeSeriesTable table = context.table();
        String column = config.getTimestampColumn();

        if (table.isTimeIndexed()) {
            return true;
        }
        if (!column.equals(table.rawTimestampColumn().orElse(null))) {
            String message = "no " + column + " column, time windows fall back to row positions";
            log.warn("Timestamp column {} missing, {} rows stay in positional order", column, table.rowCount());
            context.warn(PreprocessingWarning.Code.TIMESTAMP_COLUMN_MISSING, column, message);
            return false;
        }

        List<String> raw = table.rawTimestamps();
        long[] epochNanos = new long[raw.size()];
        for (int i = 0; i < raw.size(); i++) {
            String text = raw.get(i);
            try {
                epochNanos[i] = TimeSeriesTable.toEpochNanos(parse(text));
            } catch (DateTimeException | ArithmeticException e) {
                String message = "row " + i + " has unparseable timestamp '" + text + "'";
                log.warn("Cannot index by {}: {}", column, message);
                context.warn(PreprocessingWarning.Code.TIMESTAMP_UNPARSEABLE, column, message);
                return false;
            }
        }

        table.indexBy(column, epochNanos);
        log.info("Time index set from {} on {} rows", column, table.rowCount());
        return true;
    }

    static Instant parse(String text) {
        if (text == null || text.isBlank()) {
            throw new DateTimeParseException("blank timestamp", String.valueOf(text), 0);
        }
        TemporalAccessor parsed = TIMESTAMP_FORMAT.parse(text.trim());
        if (parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
            return OffsetDateTime.from(parsed).toInstant();
        }
        return LocalDateTime.from(parsed).toInstant(ZoneOffset.UTC);
    }
}
