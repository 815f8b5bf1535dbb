package gr.imsi.athenarc.historian.datasource.sql;

/**
 * SQL text for the supported historian databases. Bucket queries return the bucket index relative
 * to the first parameter (the grid origin) so the bucket start is computed exactly on the client.
 * Parameter order of the bucket query: origin, interval in milliseconds, tag, window start, window end.
 */
public enum SQLDialect {

    SQLSERVER {
        @Override
        public String existsQuery(String table, String tagColumn) {
            return "SELECT TOP 1 1 FROM " + table + " WITH (NOLOCK) WHERE " + tagColumn + " = ?";
        }

        @Override
        public String listTagsQuery(String table, String tagColumn) {
            return "SELECT DISTINCT " + tagColumn + " FROM " + table + " WITH (NOLOCK) ORDER BY " + tagColumn;
        }

        @Override
        public String bucketQuery(String table, String tagColumn, String timestampColumn, String valueColumn) {
            return "WITH TimeBuckets AS (\n" +
                    "    SELECT DATEDIFF_BIG(MILLISECOND, ?, " + timestampColumn + ") / ? AS bucket_index,\n" +
                    "           " + valueColumn + " AS value\n" +
                    "    FROM " + table + " WITH (NOLOCK)\n" +
                    "    WHERE " + tagColumn + " = ?\n" +
                    "    AND " + timestampColumn + " >= ?\n" +
                    "    AND " + timestampColumn + " < ?\n" +
                    ")\n" +
                    "SELECT bucket_index, AVG(CAST(value AS FLOAT)) AS value\n" +
                    "FROM TimeBuckets\n" +
                    "GROUP BY bucket_index\n" +
                    "ORDER BY bucket_index";
        }

        @Override
        public boolean supportsNativeResampling() {
            return true;
        }

        /**
         * Cyclic retrieval from the historian's {@code History} extension table. Parameter order: tag,
         * window start, window end, resolution in milliseconds.
         */
        @Override
        public String resampleQuery(String historyTable) {
            return "SELECT DATEDIFF_BIG(MILLISECOND, '1970-01-01', DateTime) AS ts_ms, Value AS value, Quality AS quality\n" +
                    "FROM " + historyTable + "\n" +
                    "WHERE TagName = ?\n" +
                    "AND DateTime >= ?\n" +
                    "AND DateTime < ?\n" +
                    "AND wwRetrievalMode = 'Cyclic'\n" +
                    "AND wwResolution = ?\n" +
                    "ORDER BY DateTime";
        }
    },

    POSTGRES {
        @Override
        public String existsQuery(String table, String tagColumn) {
            return "SELECT 1 FROM " + table + " WHERE " + tagColumn + " = ? LIMIT 1";
        }

        @Override
        public String listTagsQuery(String table, String tagColumn) {
            return "SELECT DISTINCT " + tagColumn + " FROM " + table + " ORDER BY " + tagColumn;
        }

        @Override
        public String bucketQuery(String table, String tagColumn, String timestampColumn, String valueColumn) {
            return "WITH time_buckets AS (\n" +
                    "    SELECT FLOOR(EXTRACT(EPOCH FROM (" + timestampColumn + " - CAST(? AS timestamp))) * 1000 / ?) AS bucket_index,\n" +
                    "           " + valueColumn + " AS value\n" +
                    "    FROM " + table + "\n" +
                    "    WHERE " + tagColumn + " = ?\n" +
                    "    AND " + timestampColumn + " >= ?\n" +
                    "    AND " + timestampColumn + " < ?\n" +
                    ")\n" +
                    "SELECT bucket_index, AVG(value) AS value\n" +
                    "FROM time_buckets\n" +
                    "GROUP BY bucket_index\n" +
                    "ORDER BY bucket_index";
        }

        @Override
        public boolean supportsNativeResampling() {
            return false;
        }

        @Override
        public String resampleQuery(String historyTable) {
            throw new UnsupportedOperationException("PostgreSQL has no native resampling");
        }
    };

    public abstract String existsQuery(String table, String tagColumn);

    public abstract String listTagsQuery(String table, String tagColumn);

    public abstract String bucketQuery(String table, String tagColumn, String timestampColumn, String valueColumn);

    public abstract boolean supportsNativeResampling();

    public abstract String resampleQuery(String historyTable);
}
