package gr.imsi.athenarc.historian.datasource.config;

import java.time.Duration;

import gr.imsi.athenarc.historian.datasource.sql.SQLDialect;

public class SQLConfiguration implements DataSourceConfiguration {

    private String url;
    private String username;
    private String password;
    private SQLDialect dialect = SQLDialect.SQLSERVER;
    private String tableName = "TagData";
    private String tagColumn = "TagName";
    private String timestampColumn = "Timestamp";
    private String valueColumn = "Value";
    private String historyTable = "History";
    private int poolSize = 5;
    private Duration acquireTimeout = Duration.ofSeconds(30);
    private Duration queryTimeout = Duration.ofSeconds(60);

    private SQLConfiguration() {}

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final SQLConfiguration config = new SQLConfiguration();

        public Builder url(String url) {
            config.url = url;
            return this;
        }

        public Builder username(String username) {
            config.username = username;
            return this;
        }

        public Builder password(String password) {
            config.password = password;
            return this;
        }

        public Builder dialect(SQLDialect dialect) {
            config.dialect = dialect;
            return this;
        }

        public Builder tableName(String tableName) {
            config.tableName = tableName;
            return this;
        }

        public Builder tagColumn(String tagColumn) {
            config.tagColumn = tagColumn;
            return this;
        }

        public Builder timestampColumn(String timestampColumn) {
            config.timestampColumn = timestampColumn;
            return this;
        }

        public Builder valueColumn(String valueColumn) {
            config.valueColumn = valueColumn;
            return this;
        }

        public Builder historyTable(String historyTable) {
            config.historyTable = historyTable;
            return this;
        }

        public Builder poolSize(int poolSize) {
            config.poolSize = poolSize;
            return this;
        }

        public Builder acquireTimeout(Duration acquireTimeout) {
            config.acquireTimeout = acquireTimeout;
            return this;
        }

        public Builder queryTimeout(Duration queryTimeout) {
            config.queryTimeout = queryTimeout;
            return this;
        }

        public SQLConfiguration build() {
            if (config.url == null || config.url.isBlank()) {
                throw new IllegalArgumentException("No JDBC url specified");
            }
            return config;
        }
    }

    public String getUrl() { return url; }
    public String getUsername() { return username; }
    public String getPassword() { return password; }
    public SQLDialect getDialect() { return dialect; }
    public String getTableName() { return tableName; }
    public String getTagColumn() { return tagColumn; }
    public String getTimestampColumn() { return timestampColumn; }
    public String getValueColumn() { return valueColumn; }
    public String getHistoryTable() { return historyTable; }
    @Override public int getPoolSize() { return poolSize; }
    @Override public Duration getAcquireTimeout() { return acquireTimeout; }
    @Override public Duration getQueryTimeout() { return queryTimeout; }

    @Override
    public String toString() {
        return "SQLConfiguration{" +
                "url='" + url + '\'' +
                ", dialect=" + dialect +
                ", tableName='" + tableName + '\'' +
                ", tagColumn='" + tagColumn + '\'' +
                ", timestampColumn='" + timestampColumn + '\'' +
                ", valueColumn='" + valueColumn + '\'' +
                ", historyTable='" + historyTable + '\'' +
                ", poolSize=" + poolSize +
                '}';
    }
}
