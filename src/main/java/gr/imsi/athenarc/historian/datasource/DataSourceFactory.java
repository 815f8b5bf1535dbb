package gr.imsi.athenarc.historian.datasource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.historian.datasource.config.DataSourceConfiguration;
import gr.imsi.athenarc.historian.datasource.config.InfluxDBConfiguration;
import gr.imsi.athenarc.historian.datasource.config.SQLConfiguration;
import gr.imsi.athenarc.historian.datasource.connection.ConnectionPool;
import gr.imsi.athenarc.historian.datasource.connection.InfluxDBConnection;
import gr.imsi.athenarc.historian.datasource.connection.JDBCConnection;
import gr.imsi.athenarc.historian.datasource.influx.InfluxDBTagStore;
import gr.imsi.athenarc.historian.datasource.sql.SQLTagStore;

public class DataSourceFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DataSourceFactory.class);

    private DataSourceFactory() {}

    public static HistorianDataSource<?> createDataSource(DataSourceConfiguration config) {
        if (config instanceof SQLConfiguration) {
            return createSQLDataSource((SQLConfiguration) config);
        } else if (config instanceof InfluxDBConfiguration) {
            return createInfluxDBDataSource((InfluxDBConfiguration) config);
        }
        throw new IllegalArgumentException("Unsupported data source configuration");
    }

    public static HistorianDataSource<JDBCConnection> createSQLDataSource(SQLConfiguration config) {
        SQLTagStore store = new SQLTagStore(config);
        ConnectionPool<JDBCConnection> pool = new ConnectionPool<>(config.getUrl(), config.getPoolSize(),
                () -> new JDBCConnection(config.getUrl(), config.getUsername(), config.getPassword()).connect(),
                config.getAcquireTimeout());
        LOG.info("Created SQL data source: {}", config);
        return new HistorianDataSource<>(store, pool);
    }

    public static HistorianDataSource<InfluxDBConnection> createInfluxDBDataSource(InfluxDBConfiguration config) {
        InfluxDBTagStore store = new InfluxDBTagStore(config);
        ConnectionPool<InfluxDBConnection> pool = new ConnectionPool<>(config.getUrl(), config.getPoolSize(),
                () -> new InfluxDBConnection(config.getUrl(), config.getOrg(), config.getToken(),
                        config.getBucket(), config.getQueryTimeout()).connect(),
                config.getAcquireTimeout());
        LOG.info("Created InfluxDB data source: {} bucket {} measurement {}", config.getUrl(),
                config.getBucket(), config.getMeasurement());
        return new HistorianDataSource<>(store, pool);
    }
}
