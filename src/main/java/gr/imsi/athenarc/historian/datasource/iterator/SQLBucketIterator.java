package gr.imsi.athenarc.historian.datasource.iterator;

import java.sql.ResultSet;
import java.sql.SQLException;

import gr.imsi.athenarc.historian.domain.Bucket;
import gr.imsi.athenarc.historian.domain.DateTimeUtil;

/**
 * Maps {@code (bucket_index, value)} rows of a bucketed average query to buckets on the grid
 * {@code origin + bucket_index * intervalMillis}.
 */
public class SQLBucketIterator extends SQLIterator<Bucket> {

    private final long origin;
    private final long intervalMillis;

    public SQLBucketIterator(ResultSet resultSet, long origin, long intervalMillis) {
        super(resultSet);
        this.origin = origin;
        this.intervalMillis = intervalMillis;
    }

    @Override
    protected Bucket getNext() throws SQLException {
        Long bucketIndex = getSafeLongValue("bucket_index");
        Double value = getSafeDoubleValue("value");
        if (bucketIndex == null || value == null) {
            return null;
        }
        long timestamp = origin + bucketIndex * intervalMillis;
        if (LOG.isTraceEnabled()) {
            LOG.trace("Bucket {} -> {}", DateTimeUtil.format(timestamp), value);
        }
        return new Bucket(timestamp, value);
    }
}
