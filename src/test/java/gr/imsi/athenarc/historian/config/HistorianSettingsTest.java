package gr.imsi.athenarc.historian.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import gr.imsi.athenarc.historian.datasource.config.InfluxDBConfiguration;
import gr.imsi.athenarc.historian.datasource.config.SQLConfiguration;
import gr.imsi.athenarc.historian.datasource.sql.SQLDialect;
import gr.imsi.athenarc.historian.fetch.FetchMode;
import gr.imsi.athenarc.historian.merge.FillPolicy;

public class HistorianSettingsTest {

    @TempDir
    Path directory;

    @Test
    public void testClasspathDefaults() {
        HistorianSettings settings = HistorianSettings.load();
        assertEquals(Duration.ofDays(1), settings.chunkWidth());
        assertEquals(FillPolicy.FORWARD_BACKWARD, settings.fillPolicy());
        assertEquals(FetchMode.AGGREGATE, settings.fetchMode());
        assertEquals(Duration.ofMinutes(30), settings.requestTimeout());
        assertEquals(Paths.get("configs"), settings.configDirectory());
        assertEquals("", settings.tagNaming().getPrefix());
    }

    @Test
    public void testSqlConfiguration() {
        Properties properties = new Properties();
        properties.setProperty("historian.type", "sql");
        properties.setProperty("historian.jdbc.url", "jdbc:postgresql://localhost/historian");
        properties.setProperty("historian.jdbc.dialect", "postgres");
        properties.setProperty("historian.pool.size", "3");
        properties.setProperty("historian.query.timeout", "00:02:00");

        SQLConfiguration config = (SQLConfiguration) new HistorianSettings(properties).dataSourceConfiguration();

        assertEquals(SQLDialect.POSTGRES, config.getDialect());
        assertEquals("TagData", config.getTableName());
        assertEquals(3, config.getPoolSize());
        assertEquals(Duration.ofMinutes(2), config.getQueryTimeout());
    }

    @Test
    public void testInfluxConfiguration() {
        Properties properties = new Properties();
        properties.setProperty("historian.type", "influx");
        properties.setProperty("historian.influx.url", "http://localhost:8086");
        properties.setProperty("historian.influx.token", "secret");
        properties.setProperty("historian.influx.bucket", "historian");
        properties.setProperty("historian.influx.measurement", "samples");

        InfluxDBConfiguration config = (InfluxDBConfiguration) new HistorianSettings(properties).dataSourceConfiguration();

        assertEquals("tag", config.getTagKey());
        assertEquals("value", config.getField());
    }

    @Test
    public void testMissingRequiredSetting() {
        Properties properties = new Properties();
        properties.setProperty("historian.type", "influx");
        assertThrows(IllegalArgumentException.class, () -> new HistorianSettings(properties).dataSourceConfiguration());
        properties.setProperty("historian.type", "oracle");
        assertThrows(IllegalArgumentException.class, () -> new HistorianSettings(properties).dataSourceConfiguration());
    }

    @Test
    public void testExternalFileAndSystemPropertiesOverride() throws IOException {
        Path overrides = directory.resolve("site.properties");
        Files.write(overrides, List.of("tags.prefix=MELSRV01.", "export.fillPolicy=none", "export.chunkWidth=PT12H"));
        System.setProperty("export.chunkWidth", "PT6H");
        try {
            HistorianSettings settings = HistorianSettings.load(overrides);
            assertEquals("MELSRV01.", settings.tagNaming().getPrefix());
            assertEquals(FillPolicy.NONE, settings.fillPolicy());
            assertEquals(Duration.ofHours(6), settings.chunkWidth());
        } finally {
            System.clearProperty("export.chunkWidth");
        }
    }

    @Test
    public void testInvalidNumber() {
        Properties properties = new Properties();
        properties.setProperty("export.parallelism", "many");
        assertThrows(IllegalArgumentException.class, () -> new HistorianSettings(properties).parallelism());
        assertTrue(new HistorianSettings(new Properties()).parallelism() == 0);
    }
}
