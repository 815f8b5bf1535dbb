package gr.imsi.athenarc.historian.datasource.sql;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.historian.datasource.config.SQLConfiguration;

public class SQLDialectTest {

    @Test
    public void testSqlServerBucketQueryGroupsOnIndex() {
        String query = SQLDialect.SQLSERVER.bucketQuery("TagData", "TagName", "Timestamp", "Value");
        assertTrue(query.contains("DATEDIFF_BIG(MILLISECOND, ?, Timestamp) / ?"));
        assertTrue(query.contains("Timestamp >= ?"));
        assertTrue(query.contains("Timestamp < ?"));
        assertTrue(query.contains("GROUP BY bucket_index"));
    }

    @Test
    public void testOnlySqlServerResamplesNatively() {
        assertTrue(SQLDialect.SQLSERVER.supportsNativeResampling());
        assertTrue(SQLDialect.SQLSERVER.resampleQuery("History").contains("wwRetrievalMode = 'Cyclic'"));
        assertFalse(SQLDialect.POSTGRES.supportsNativeResampling());
        assertThrows(UnsupportedOperationException.class, () -> SQLDialect.POSTGRES.resampleQuery("History"));
    }

    @Test
    public void testStoreRejectsUnsafeIdentifiers() {
        SQLConfiguration config = SQLConfiguration.builder()
                .url("jdbc:postgresql://localhost/historian")
                .dialect(SQLDialect.POSTGRES)
                .tableName("TagData; DROP TABLE TagData")
                .build();
        assertThrows(IllegalArgumentException.class, () -> new SQLTagStore(config));
    }
}
