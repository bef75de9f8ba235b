package com.kotsin.nox.infrastructure.json;

import com.kotsin.nox.config.FeatureConstants;
import com.kotsin.nox.config.PreprocessingConfig;
import com.kotsin.nox.model.ModelInputMatrix;
import com.kotsin.nox.model.TimeSeriesTable;
import com.kotsin.nox.service.NoxPreprocessingPipeline;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TimeSeriesTableReader - Store records to table")
class TimeSeriesTableReaderTest {

    private final TimeSeriesTableReader reader = new TimeSeriesTableReader(new PreprocessingConfig());

    @Test
    @DisplayName("Lower-cases channels, maps time to the timestamp column, marks absent values missing")
    void testRead() throws Exception {
        String json = "["
            + "{\"time\":\"2025-07-01T00:00:00Z\",\"ICF_CRA_WT_K\":500,\"NOX_VALUE\":\"48.5\"},"
            + "{\"time\":\"2025-07-01T00:00:01Z\",\"ICF_CRA_WT_K\":499.5,\"flag\":true}"
            + "]";

        TimeSeriesTable table = reader.read(json);

        assertEquals(2, table.rowCount());
        assertEquals(FeatureConstants.TIMESTAMP_COLUMN, table.rawTimestampColumn().orElseThrow());
        assertEquals(List.of("2025-07-01T00:00:00Z", "2025-07-01T00:00:01Z"), table.rawTimestamps());
        assertArrayEquals(new double[]{500, 499.5}, table.column(FeatureConstants.WEIGHT_CHANNEL));
        assertEquals(48.5, table.column(FeatureConstants.TARGET_COLUMN)[0]);
        assertTrue(Double.isNaN(table.column(FeatureConstants.TARGET_COLUMN)[1]));
        assertEquals(1.0, table.column("flag")[1]);
        assertFalse(table.hasColumn("time"));
    }

    @Test
    @DisplayName("Records without time give a table without raw timestamps")
    void testNoTime() throws Exception {
        TimeSeriesTable table = reader.read(new ByteArrayInputStream(
            "[{\"a\":1},{\"a\":null}]".getBytes(StandardCharsets.UTF_8)));

        assertTrue(table.rawTimestampColumn().isEmpty());
        assertEquals(1.0, table.column("a")[0]);
        assertTrue(Double.isNaN(table.column("a")[1]));
    }

    @Test
    @DisplayName("Non-array document is rejected")
    void testNotArray() {
        assertThrows(IllegalArgumentException.class, () -> reader.read("{\"a\":1}"));
    }

    @Test
    @DisplayName("Infinite and NaN readings are read as missing")
    void testNonFiniteReadings() throws Exception {
        String json = "["
            + "{\"time\":\"2025-01-01T00:00:00Z\",\"BR1_EO_O2_A\":\"Infinity\",\"a\":1e400},"
            + "{\"time\":\"2025-01-01T00:00:01Z\",\"BR1_EO_O2_A\":\"-Infinity\",\"a\":\"NaN\"},"
            + "{\"time\":\"2025-01-01T00:00:02Z\",\"BR1_EO_O2_A\":1,\"a\":2}"
            + "]";

        TimeSeriesTable table = reader.read(json);

        double[] o2 = table.column("br1_eo_o2_a");
        assertTrue(Double.isNaN(o2[0]));
        assertTrue(Double.isNaN(o2[1]));
        assertEquals(1.0, o2[2]);
        assertTrue(Double.isNaN(table.column("a")[0]));
        assertTrue(Double.isNaN(table.column("a")[1]));
    }

    @Test
    @DisplayName("Infinite reading read from JSON never reaches the model matrix")
    void testNonFiniteReadingThroughPipeline() throws Exception {
        String json = "[{\"time\":\"2025-01-01T00:00:00Z\",\"BR1_EO_O2_A\":\"Infinity\"},"
            + "{\"time\":\"2025-01-01T00:00:01Z\",\"BR1_EO_O2_A\":1}]";

        ModelInputMatrix matrix = NoxPreprocessingPipeline.create(new PreprocessingConfig())
            .process(reader.read(json))
            .getMatrix();

        for (int r = 0; r < matrix.rowCount(); r++) {
            for (double v : matrix.row(r)) {
                assertTrue(Double.isFinite(v), "row " + r);
            }
        }
        assertEquals(0.0, matrix.value(0, "br1_eo_o2_a"));
    }

    @Test
    @DisplayName("Null record is rejected with its row number")
    void testNullRecord() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> reader.read("[{\"a\":1},null]"));

        assertTrue(e.getMessage().contains("Record 1"));
    }

    @Test
    @DisplayName("Value conversion")
    void testToDouble() {
        assertEquals(3.0, TimeSeriesTableReader.toDouble(3));
        assertEquals(2.5, TimeSeriesTableReader.toDouble(" 2.5 "));
        assertEquals(0.0, TimeSeriesTableReader.toDouble(false));
        assertTrue(Double.isNaN(TimeSeriesTableReader.toDouble("n/a")));
        assertTrue(Double.isNaN(TimeSeriesTableReader.toDouble(null)));
        assertTrue(Double.isNaN(TimeSeriesTableReader.toDouble("Infinity")));
        assertTrue(Double.isNaN(TimeSeriesTableReader.toDouble(Double.NEGATIVE_INFINITY)));
    }
}
