package gr.imsi.athenarc.historian.datasource.iterator;

import java.sql.ResultSet;
import java.sql.SQLException;

import gr.imsi.athenarc.historian.domain.Bucket;

/**
 * Maps {@code (ts_ms, value)} rows resampled by the store. Rows without a value are skipped.
 */
public class SQLResampledIterator extends SQLIterator<Bucket> {

    public SQLResampledIterator(ResultSet resultSet) {
        super(resultSet);
    }

    @Override
    protected Bucket getNext() throws SQLException {
        Long timestamp = getSafeLongValue("ts_ms");
        Double value = getSafeDoubleValue("value");
        if (timestamp == null || value == null) {
            return null;
        }
        return new Bucket(timestamp, value);
    }
}
