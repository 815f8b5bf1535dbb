package gr.imsi.athenarc.historian.datasource.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

import com.influxdb.client.InfluxDBClient;
import com.influxdb.client.InfluxDBClientFactory;
import com.influxdb.client.InfluxDBClientOptions;
import com.influxdb.exceptions.InfluxException;

import okhttp3.OkHttpClient;

import gr.imsi.athenarc.historian.datasource.DataSourceException;

public class InfluxDBConnection implements DatabaseConnection {
    private static final Logger LOG = LoggerFactory.getLogger(InfluxDBConnection.class);

    private final String url;
    private final String org;
    private final String token;
    private final String bucket;
    private final Duration queryTimeout;
    private InfluxDBClient client;

    public InfluxDBConnection(String url, String org, String token, String bucket, Duration queryTimeout) {
        this.url = url;
        this.org = org;
        this.token = token;
        this.bucket = bucket;
        this.queryTimeout = queryTimeout;
    }

    @Override
    public InfluxDBConnection connect() {
        try {
            InfluxDBClientOptions options = InfluxDBClientOptions.builder()
                    .url(url)
                    .authenticateToken(token.toCharArray())
                    .org(org)
                    .bucket(bucket)
                    .okHttpClient(new OkHttpClient.Builder().readTimeout(queryTimeout))
                    .build();
            client = InfluxDBClientFactory.create(options);
        } catch (InfluxException e) {
            throw new DataSourceException("Could not create InfluxDB client for " + url, e);
        }
        if (!Boolean.TRUE.equals(client.ping())) {
            client.close();
            throw new DataSourceException("InfluxDB at " + url + " is not reachable");
        }
        LOG.info("Initialized InfluxDB connection {}", url);
        return this;
    }

    @Override
    public boolean isValid() {
        return client != null && Boolean.TRUE.equals(client.ping());
    }

    @Override
    public void closeConnection() {
        if (client != null) {
            client.close();
        }
    }

    public InfluxDBClient getClient() {
        return client;
    }

    public String getOrg() {
        return org;
    }

    public String getBucket() {
        return bucket;
    }
}
