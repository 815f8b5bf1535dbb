package gr.imsi.athenarc.historian.datasource.iterator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.historian.datasource.DataSourceException;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Iterates the rows of a {@link ResultSet}. Rows that {@link #getNext()} maps to {@code null} are
 * skipped. Errors while reading are raised as {@link DataSourceException}, never turned into an
 * early end of data.
 */
public abstract class SQLIterator<T> implements Iterator<T> {
    protected static final Logger LOG = LoggerFactory.getLogger(SQLIterator.class);

    protected final ResultSet resultSet;
    private T nextElement;
    private boolean exhausted;

    protected SQLIterator(ResultSet resultSet) {
        if (resultSet == null) {
            throw new IllegalArgumentException("ResultSet cannot be null");
        }
        this.resultSet = resultSet;
    }

    @Override
    public boolean hasNext() {
        while (nextElement == null && !exhausted) {
            try {
                if (resultSet.next()) {
                    nextElement = getNext();
                } else {
                    exhausted = true;
                }
            } catch (SQLException e) {
                throw new DataSourceException("Error reading result set", e);
            }
        }
        return nextElement != null;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more elements to iterate over");
        }
        T element = nextElement;
        nextElement = null;
        return element;
    }

    protected Double getSafeDoubleValue(String columnName) throws SQLException {
        double value = resultSet.getDouble(columnName);
        return resultSet.wasNull() ? null : value;
    }

    protected Long getSafeLongValue(String columnName) throws SQLException {
        long value = resultSet.getLong(columnName);
        return resultSet.wasNull() ? null : value;
    }

    /**
     * Maps the current row, or returns {@code null} to skip it.
     */
    protected abstract T getNext() throws SQLException;
}
