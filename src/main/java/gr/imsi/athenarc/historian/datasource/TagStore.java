package gr.imsi.athenarc.historian.datasource;

import java.util.Collection;
import java.util.List;
import java.util.Set;

import gr.imsi.athenarc.historian.datasource.connection.DatabaseConnection;
import gr.imsi.athenarc.historian.domain.Bucket;
import gr.imsi.athenarc.historian.domain.TimeRange;

/**
 * Query contract of a remote time series store holding one series per tag.
 * All methods throw {@link DataSourceException} when the query fails.
 *
 * @param <C> the connection type the store runs its queries on
 */
public interface TagStore<C extends DatabaseConnection> {

    boolean tagExists(C connection, String tag);

    /**
     * Whether {@link #existingTags} answers in one round trip. Stores without batch lookup are
     * checked tag by tag.
     */
    default boolean supportsBatchLookup() {
        return false;
    }

    /**
     * Returns the names of the store matching {@code tags}, compared ignoring case and repeated
     * whitespace, in the spelling the store uses.
     */
    default Set<String> existingTags(C connection, Collection<String> tags) {
        throw new UnsupportedOperationException("Batch tag lookup is not supported by " + getClass().getSimpleName());
    }

    /**
     * Lists the distinct tag names of the store in ascending order.
     */
    List<String> listTags(C connection);

    /**
     * Returns the mean of the samples of {@code tag} in each bucket of the grid
     * {@code origin + k * intervalMillis}, restricted to samples inside {@code window}.
     * Buckets without samples are omitted.
     *
     * @param window half-open window to read samples from
     * @param origin start of the grid, shared by all windows of one request
     * @param intervalMillis bucket width
     * @return buckets in ascending timestamp order
     */
    List<Bucket> bucketAverages(C connection, String tag, TimeRange window, long origin, long intervalMillis);

    boolean supportsNativeResampling();

    /**
     * Lets the store resample {@code tag} itself at a fixed step inside {@code window}. Rows are
     * returned as produced by the store, one per step, in ascending timestamp order.
     */
    default List<Bucket> resample(C connection, String tag, TimeRange window, long intervalMillis) {
        throw new UnsupportedOperationException("Native resampling is not supported by " + getClass().getSimpleName());
    }
}
