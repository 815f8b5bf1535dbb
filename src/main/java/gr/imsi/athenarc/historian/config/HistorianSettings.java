package gr.imsi.athenarc.historian.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.historian.HistorianExportException;
import gr.imsi.athenarc.historian.datasource.config.DataSourceConfiguration;
import gr.imsi.athenarc.historian.datasource.config.InfluxDBConfiguration;
import gr.imsi.athenarc.historian.datasource.config.SQLConfiguration;
import gr.imsi.athenarc.historian.datasource.sql.SQLDialect;
import gr.imsi.athenarc.historian.domain.DateTimeUtil;
import gr.imsi.athenarc.historian.fetch.ChunkedBucketFetcher;
import gr.imsi.athenarc.historian.fetch.FetchMode;
import gr.imsi.athenarc.historian.merge.FillPolicy;
import gr.imsi.athenarc.historian.tag.TagNaming;

/**
 * Settings read from {@code application.properties} on the classpath, optionally overridden by an
 * external properties file and then by JVM system properties with the same keys.
 */
public class HistorianSettings {

    private static final Logger LOG = LoggerFactory.getLogger(HistorianSettings.class);

    public static final String RESOURCE = "/application.properties";

    private final Properties properties;

    public HistorianSettings(Properties properties) {
        this.properties = properties;
    }

    public static HistorianSettings load() {
        return load(null);
    }

    /**
     * @param overrides external properties file, may be {@code null}
     */
    public static HistorianSettings load(Path overrides) {
        Properties properties = new Properties();
        try (InputStream input = HistorianSettings.class.getResourceAsStream(RESOURCE)) {
            if (input == null) {
                LOG.warn("Unable to find {} in resources, using defaults", RESOURCE);
            } else {
                properties.load(input);
            }
        } catch (IOException e) {
            throw new HistorianExportException("Unable to read " + RESOURCE, e);
        }
        if (overrides != null) {
            try (Reader reader = Files.newBufferedReader(overrides, StandardCharsets.UTF_8)) {
                properties.load(reader);
                LOG.info("Loaded settings from {}", overrides);
            } catch (IOException e) {
                throw new HistorianExportException("Unable to read settings file " + overrides, e);
            }
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("historian.") || key.startsWith("tags.") || key.startsWith("export.")) {
                properties.setProperty(key, System.getProperty(key));
            }
        }
        return new HistorianSettings(properties);
    }

    public String get(String key) {
        String value = properties.getProperty(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    public String get(String key, String defaultValue) {
        String value = get(key);
        return value == null ? defaultValue : value;
    }

    public int getInt(String key, int defaultValue) {
        String value = get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting " + key + " is not a number: " + value, e);
        }
    }

    public Duration getDuration(String key, Duration defaultValue) {
        String value = get(key);
        return value == null ? defaultValue : DateTimeUtil.parseDuration(value);
    }

    private String require(String key) {
        String value = get(key);
        if (value == null) {
            throw new IllegalArgumentException("Missing setting " + key);
        }
        return value;
    }

    public DataSourceConfiguration dataSourceConfiguration() {
        String type = get("historian.type", "sql").toLowerCase(Locale.ROOT);
        int poolSize = getInt("historian.pool.size", 5);
        Duration acquireTimeout = getDuration("historian.pool.acquireTimeout", Duration.ofSeconds(30));
        Duration queryTimeout = getDuration("historian.query.timeout", Duration.ofSeconds(60));
        switch (type) {
            case "sql":
                SQLConfiguration.Builder sql = SQLConfiguration.builder()
                        .url(require("historian.jdbc.url"))
                        .username(get("historian.jdbc.user"))
                        .password(get("historian.jdbc.password"))
                        .dialect(SQLDialect.valueOf(get("historian.jdbc.dialect", "SQLSERVER").toUpperCase(Locale.ROOT)))
                        .tableName(get("historian.jdbc.table", "TagData"))
                        .tagColumn(get("historian.jdbc.tagColumn", "TagName"))
                        .timestampColumn(get("historian.jdbc.timestampColumn", "Timestamp"))
                        .valueColumn(get("historian.jdbc.valueColumn", "Value"))
                        .historyTable(get("historian.jdbc.historyTable", "History"))
                        .poolSize(poolSize)
                        .acquireTimeout(acquireTimeout)
                        .queryTimeout(queryTimeout);
                return sql.build();
            case "influx":
                return new InfluxDBConfiguration.Builder()
                        .url(require("historian.influx.url"))
                        .org(get("historian.influx.org"))
                        .token(require("historian.influx.token"))
                        .bucket(require("historian.influx.bucket"))
                        .measurement(require("historian.influx.measurement"))
                        .tagKey(get("historian.influx.tagKey", "tag"))
                        .field(get("historian.influx.field", "value"))
                        .poolSize(poolSize)
                        .acquireTimeout(acquireTimeout)
                        .queryTimeout(queryTimeout)
                        .build();
            default:
                throw new IllegalArgumentException("Unknown historian.type: " + type + " (expected sql or influx)");
        }
    }

    public TagNaming tagNaming() {
        return new TagNaming(get("tags.prefix", ""), get("tags.suffix", ""), get("tags.fileSuffix", ".csv"));
    }

    public Duration chunkWidth() {
        return getDuration("export.chunkWidth", ChunkedBucketFetcher.DEFAULT_CHUNK_WIDTH);
    }

    public FillPolicy fillPolicy() {
        return FillPolicy.parse(get("export.fillPolicy", FillPolicy.FORWARD_BACKWARD.name()));
    }

    public FetchMode fetchMode() {
        return FetchMode.valueOf(get("export.mode", FetchMode.AGGREGATE.name()).toUpperCase(Locale.ROOT));
    }

    /**
     * @return worker count for parallel tag fetches, zero to use the pool size
     */
    public int parallelism() {
        return getInt("export.parallelism", 0);
    }

    public Duration requestTimeout() {
        return getDuration("export.requestTimeout", Duration.ofMinutes(30));
    }

    public Path outputDirectory() {
        return Paths.get(get("export.outputDir", "exports"));
    }

    public Path configDirectory() {
        return Paths.get(get("export.configDir", "configs"));
    }
}
