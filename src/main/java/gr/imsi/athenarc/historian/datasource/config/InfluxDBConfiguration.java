package gr.imsi.athenarc.historian.datasource.config;

import java.time.Duration;

public class InfluxDBConfiguration implements DataSourceConfiguration {
    private final String url;
    private final String org;
    private final String token;
    private final String bucket;
    private final String measurement;
    private final String tagKey;
    private final String field;
    private final int poolSize;
    private final Duration acquireTimeout;
    private final Duration queryTimeout;

    private InfluxDBConfiguration(Builder builder) {
        this.url = builder.url;
        this.org = builder.org;
        this.token = builder.token;
        this.bucket = builder.bucket;
        this.measurement = builder.measurement;
        this.tagKey = builder.tagKey;
        this.field = builder.field;
        this.poolSize = builder.poolSize;
        this.acquireTimeout = builder.acquireTimeout;
        this.queryTimeout = builder.queryTimeout;
    }

    public String getUrl() { return url; }
    public String getOrg() { return org; }
    public String getToken() { return token; }
    public String getBucket() { return bucket; }
    public String getMeasurement() { return measurement; }
    public String getTagKey() { return tagKey; }
    public String getField() { return field; }
    @Override public int getPoolSize() { return poolSize; }
    @Override public Duration getAcquireTimeout() { return acquireTimeout; }
    @Override public Duration getQueryTimeout() { return queryTimeout; }

    public static class Builder {
        private String url, org, token, bucket, measurement;
        private String tagKey = "tag";
        private String field = "value";
        private int poolSize = 5;
        private Duration acquireTimeout = Duration.ofSeconds(30);
        private Duration queryTimeout = Duration.ofSeconds(60);

        public Builder url(String url) { this.url = url; return this; }
        public Builder org(String org) { this.org = org; return this; }
        public Builder token(String token) { this.token = token; return this; }
        public Builder bucket(String bucket) { this.bucket = bucket; return this; }
        public Builder measurement(String measurement) { this.measurement = measurement; return this; }
        public Builder tagKey(String tagKey) { this.tagKey = tagKey; return this; }
        public Builder field(String field) { this.field = field; return this; }
        public Builder poolSize(int poolSize) { this.poolSize = poolSize; return this; }
        public Builder acquireTimeout(Duration acquireTimeout) { this.acquireTimeout = acquireTimeout; return this; }
        public Builder queryTimeout(Duration queryTimeout) { this.queryTimeout = queryTimeout; return this; }

        public InfluxDBConfiguration build() {
            if (url == null || token == null || bucket == null || measurement == null) {
                throw new IllegalArgumentException("InfluxDB url, token, bucket and measurement are required");
            }
            return new InfluxDBConfiguration(this);
        }
    }
}
