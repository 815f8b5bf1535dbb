package gr.imsi.athenarc.historian.datasource.influx;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import com.influxdb.client.InfluxDBClient;
import com.influxdb.client.QueryApi;
import com.influxdb.exceptions.InfluxException;
import com.influxdb.query.FluxRecord;
import com.influxdb.query.FluxTable;

import gr.imsi.athenarc.historian.datasource.DataSourceException;
import gr.imsi.athenarc.historian.datasource.config.InfluxDBConfiguration;
import gr.imsi.athenarc.historian.datasource.connection.InfluxDBConnection;
import gr.imsi.athenarc.historian.domain.Bucket;
import gr.imsi.athenarc.historian.domain.DateTimeUtil;
import gr.imsi.athenarc.historian.domain.TimeRange;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
public class InfluxDBTagStoreTest {

    private static final long HOUR = 3_600_000L;

    @Mock
    private InfluxDBConnection connection;
    @Mock
    private InfluxDBClient client;
    @Mock
    private QueryApi queryApi;

    private InfluxDBTagStore store;

    @BeforeEach
    public void setUp() {
        store = new InfluxDBTagStore(new InfluxDBConfiguration.Builder()
                .url("http://localhost:8086")
                .org("plant")
                .token("secret")
                .bucket("historian")
                .measurement("samples")
                .build());
        when(connection.getClient()).thenReturn(client);
        when(connection.getOrg()).thenReturn("plant");
        when(client.getQueryApi()).thenReturn(queryApi);
    }

    private static FluxTable table(Object... timeValuePairs) {
        FluxTable table = new FluxTable();
        for (int i = 0; i < timeValuePairs.length; i += 2) {
            FluxRecord record = new FluxRecord(0);
            record.getValues().put("_time", timeValuePairs[i]);
            record.getValues().put("_value", timeValuePairs[i + 1]);
            table.getRecords().add(record);
        }
        return table;
    }

    @Test
    public void testBucketAveragesUsesRequestGridOffset() {
        long origin = DateTimeUtil.parseDateTimeString("2024-01-01 00:30:00");
        TimeRange window = new TimeRange(origin + 24 * HOUR, origin + 48 * HOUR);
        when(queryApi.query(anyString(), eq("plant"))).thenReturn(List.of(table(
                Instant.ofEpochMilli(origin + 26 * HOUR), 2.0,
                Instant.ofEpochMilli(origin + 24 * HOUR), 1.0,
                Instant.ofEpochMilli(origin + 25 * HOUR), "n/a")));

        List<Bucket> buckets = store.bucketAverages(connection, "T1", window, origin, HOUR);

        assertEquals(List.of(new Bucket(origin + 24 * HOUR, 1.0), new Bucket(origin + 26 * HOUR, 2.0)), buckets);
        ArgumentCaptor<String> flux = ArgumentCaptor.forClass(String.class);
        verify(queryApi).query(flux.capture(), eq("plant"));
        assertTrue(flux.getValue().contains("every: 3600000ms, offset: 1800000ms"));
        assertTrue(flux.getValue().contains("r[\"tag\"] == \"T1\""));
        assertTrue(flux.getValue().contains("range(start: 2024-01-02T00:30:00.000Z, stop: 2024-01-03T00:30:00.000Z)"));
    }

    @Test
    public void testExistingTagsReturnsStoredSpelling() {
        when(queryApi.query(anyString(), eq("plant"))).thenReturn(List.of(table(null, "T1", null, "T2")));
        Set<String> existing = store.existingTags(connection, List.of("T1", " t2", "T3"));
        assertEquals(Set.of("T1", "T2"), existing);
        assertTrue(store.supportsBatchLookup());
        assertFalse(store.supportsNativeResampling());
    }

    @Test
    public void testQueryErrorBecomesDataSourceException() {
        when(queryApi.query(anyString(), eq("plant"))).thenThrow(new InfluxException("unauthorized"));
        assertThrows(DataSourceException.class, () -> store.listTags(connection));
    }

    @Test
    public void testEscapeQuotes() {
        assertEquals("a\\\"b\\\\c", InfluxDBTagStore.escape("a\"b\\c"));
    }
}
