package gr.imsi.athenarc.historian.datasource.config;

import java.time.Duration;

public interface DataSourceConfiguration {

    int getPoolSize();

    Duration getAcquireTimeout();

    Duration getQueryTimeout();
}
