package gr.imsi.athenarc.historian.datasource.sql;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

import gr.imsi.athenarc.historian.datasource.DataSourceException;
import gr.imsi.athenarc.historian.datasource.TagStore;
import gr.imsi.athenarc.historian.datasource.config.SQLConfiguration;
import gr.imsi.athenarc.historian.datasource.connection.JDBCConnection;
import gr.imsi.athenarc.historian.datasource.iterator.SQLBucketIterator;
import gr.imsi.athenarc.historian.datasource.iterator.SQLResampledIterator;
import gr.imsi.athenarc.historian.domain.Bucket;
import gr.imsi.athenarc.historian.domain.DateTimeUtil;
import gr.imsi.athenarc.historian.domain.TimeRange;

/**
 * Tag store over a historian table of raw samples {@code (tag, timestamp, value)}.
 */
public class SQLTagStore implements TagStore<JDBCConnection> {

    private static final Logger LOG = LoggerFactory.getLogger(SQLTagStore.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

    private final SQLDialect dialect;
    private final int queryTimeoutSeconds;
    private final String existsQuery;
    private final String listTagsQuery;
    private final String bucketQuery;
    private final String resampleQuery;

    public SQLTagStore(SQLConfiguration config) {
        this.dialect = config.getDialect();
        this.queryTimeoutSeconds = (int) Math.max(0, config.getQueryTimeout().getSeconds());
        String table = identifier(config.getTableName());
        String tagColumn = identifier(config.getTagColumn());
        String timestampColumn = identifier(config.getTimestampColumn());
        String valueColumn = identifier(config.getValueColumn());
        this.existsQuery = dialect.existsQuery(table, tagColumn);
        this.listTagsQuery = dialect.listTagsQuery(table, tagColumn);
        this.bucketQuery = dialect.bucketQuery(table, tagColumn, timestampColumn, valueColumn);
        this.resampleQuery = dialect.supportsNativeResampling()
                ? dialect.resampleQuery(identifier(config.getHistoryTable())) : null;
    }

    private static String identifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier: " + name);
        }
        return name;
    }

    @Override
    public boolean tagExists(JDBCConnection connection, String tag) {
        try (PreparedStatement statement = prepare(connection, existsQuery)) {
            statement.setString(1, tag);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next();
            }
        } catch (SQLException e) {
            throw new DataSourceException("Error checking tag " + tag, e);
        }
    }

    @Override
    public List<String> listTags(JDBCConnection connection) {
        try (PreparedStatement statement = prepare(connection, listTagsQuery);
             ResultSet resultSet = statement.executeQuery()) {
            List<String> tags = new ArrayList<>();
            while (resultSet.next()) {
                String tag = resultSet.getString(1);
                if (tag != null) {
                    tags.add(tag);
                }
            }
            LOG.info("Listed {} tags", tags.size());
            return tags;
        } catch (SQLException e) {
            throw new DataSourceException("Error listing tags", e);
        }
    }

    @Override
    public List<Bucket> bucketAverages(JDBCConnection connection, String tag, TimeRange window,
                                       long origin, long intervalMillis) {
        try (PreparedStatement statement = prepare(connection, bucketQuery)) {
            statement.setObject(1, DateTimeUtil.toLocalDateTime(origin));
            statement.setLong(2, intervalMillis);
            statement.setString(3, tag);
            statement.setObject(4, DateTimeUtil.toLocalDateTime(window.getFrom()));
            statement.setObject(5, DateTimeUtil.toLocalDateTime(window.getTo()));
            try (ResultSet resultSet = statement.executeQuery()) {
                return Lists.newArrayList(new SQLBucketIterator(resultSet, origin, intervalMillis));
            }
        } catch (SQLException e) {
            throw new DataSourceException("Error querying buckets of " + tag + " in " + window, e);
        }
    }

    @Override
    public boolean supportsNativeResampling() {
        return resampleQuery != null;
    }

    @Override
    public List<Bucket> resample(JDBCConnection connection, String tag, TimeRange window, long intervalMillis) {
        if (resampleQuery == null) {
            throw new UnsupportedOperationException("Native resampling is not supported by " + dialect);
        }
        try (PreparedStatement statement = prepare(connection, resampleQuery)) {
            statement.setString(1, tag);
            statement.setObject(2, DateTimeUtil.toLocalDateTime(window.getFrom()));
            statement.setObject(3, DateTimeUtil.toLocalDateTime(window.getTo()));
            statement.setLong(4, intervalMillis);
            try (ResultSet resultSet = statement.executeQuery()) {
                return Lists.newArrayList(new SQLResampledIterator(resultSet));
            }
        } catch (SQLException e) {
            throw new DataSourceException("Error resampling " + tag + " in " + window, e);
        }
    }

    private PreparedStatement prepare(JDBCConnection connection, String query) throws SQLException {
        LOG.debug("Executing Query: \n{}", query);
        PreparedStatement statement = connection.getConnection().prepareStatement(query);
        try {
            statement.setQueryTimeout(queryTimeoutSeconds);
        } catch (SQLException e) {
            statement.close();
            throw e;
        }
        return statement;
    }
}
