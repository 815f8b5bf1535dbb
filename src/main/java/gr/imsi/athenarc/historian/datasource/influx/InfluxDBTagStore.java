package gr.imsi.athenarc.historian.datasource.influx;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.influxdb.exceptions.InfluxException;
import com.influxdb.query.FluxRecord;
import com.influxdb.query.FluxTable;

import gr.imsi.athenarc.historian.datasource.DataSourceException;
import gr.imsi.athenarc.historian.datasource.TagStore;
import gr.imsi.athenarc.historian.datasource.config.InfluxDBConfiguration;
import gr.imsi.athenarc.historian.datasource.connection.InfluxDBConnection;
import gr.imsi.athenarc.historian.domain.Bucket;
import gr.imsi.athenarc.historian.domain.DateTimeUtil;
import gr.imsi.athenarc.historian.domain.Tag;
import gr.imsi.athenarc.historian.domain.TimeRange;

/**
 * Tag store over an InfluxDB 2.x bucket where each historian tag is a value of the tag key
 * {@code tagKey} of one measurement. Buckets are computed by Flux {@code aggregateWindow}, with the
 * window offset derived from the request origin so every chunk uses the same grid.
 */
public class InfluxDBTagStore implements TagStore<InfluxDBConnection> {

    private static final Logger LOG = LoggerFactory.getLogger(InfluxDBTagStore.class);

    private static final String FLUX_TIME_FORMAT = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'";

    private final String bucket;
    private final String measurement;
    private final String tagKey;
    private final String field;

    public InfluxDBTagStore(InfluxDBConfiguration config) {
        this.bucket = config.getBucket();
        this.measurement = config.getMeasurement();
        this.tagKey = config.getTagKey();
        this.field = config.getField();
    }

    @Override
    public boolean tagExists(InfluxDBConnection connection, String tag) {
        return !existingTags(connection, Collections.singleton(tag)).isEmpty();
    }

    @Override
    public boolean supportsBatchLookup() {
        return true;
    }

    @Override
    public Set<String> existingTags(InfluxDBConnection connection, Collection<String> tags) {
        Map<String, String> known = new HashMap<>();
        for (String name : listTags(connection)) {
            known.put(Tag.normalizeKey(name), name);
        }
        Set<String> existing = new HashSet<>();
        for (String tag : tags) {
            String name = known.get(Tag.normalizeKey(tag));
            if (name != null) {
                existing.add(name);
            }
        }
        return existing;
    }

    @Override
    public List<String> listTags(InfluxDBConnection connection) {
        String flux = "import \"influxdata/influxdb/schema\"\n" +
                "schema.tagValues(bucket: \"" + escape(bucket) + "\", tag: \"" + escape(tagKey) + "\",\n" +
                "  predicate: (r) => r[\"_measurement\"] == \"" + escape(measurement) + "\",\n" +
                "  start: 1970-01-01T00:00:00Z)\n";
        Set<String> tags = new TreeSet<>();
        for (FluxTable table : execute(connection, flux)) {
            for (FluxRecord record : table.getRecords()) {
                Object value = record.getValue();
                if (value != null) {
                    tags.add(value.toString());
                }
            }
        }
        return new ArrayList<>(tags);
    }

    @Override
    public List<Bucket> bucketAverages(InfluxDBConnection connection, String tag, TimeRange window,
                                       long origin, long intervalMillis) {
        long offset = Math.floorMod(origin, intervalMillis);
        String flux = "from(bucket: \"" + escape(bucket) + "\")\n" +
                "  |> range(start: " + DateTimeUtil.format(window.getFrom(), FLUX_TIME_FORMAT) +
                ", stop: " + DateTimeUtil.format(window.getTo(), FLUX_TIME_FORMAT) + ")\n" +
                "  |> filter(fn: (r) => r[\"_measurement\"] == \"" + escape(measurement) + "\")\n" +
                "  |> filter(fn: (r) => r[\"" + escape(tagKey) + "\"] == \"" + escape(tag) + "\")\n" +
                "  |> filter(fn: (r) => r[\"_field\"] == \"" + escape(field) + "\")\n" +
                "  |> group()\n" +
                "  |> aggregateWindow(every: " + intervalMillis + "ms, offset: " + offset + "ms, fn: mean," +
                " createEmpty: false, timeSrc: \"_start\")\n";

        List<Bucket> buckets = new ArrayList<>();
        for (FluxTable table : execute(connection, flux)) {
            for (FluxRecord record : table.getRecords()) {
                Object value = record.getValue();
                if (!(value instanceof Number) || record.getTime() == null) {
                    continue;
                }
                long timestamp = DateTimeUtil.bucketStart(origin, intervalMillis, record.getTime().toEpochMilli());
                buckets.add(new Bucket(timestamp, ((Number) value).doubleValue()));
            }
        }
        buckets.sort(Comparator.comparingLong(Bucket::getTimestamp));
        return buckets;
    }

    @Override
    public boolean supportsNativeResampling() {
        return false;
    }

    private List<FluxTable> execute(InfluxDBConnection connection, String flux) {
        LOG.debug("Executing Query: \n{}", flux);
        try {
            return connection.getClient().getQueryApi().query(flux, connection.getOrg());
        } catch (InfluxException e) {
            throw new DataSourceException("Error executing Flux query on bucket " + bucket, e);
        }
    }

    static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
