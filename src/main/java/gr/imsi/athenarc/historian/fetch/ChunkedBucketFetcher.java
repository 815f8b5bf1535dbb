package gr.imsi.athenarc.historian.fetch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;

import gr.imsi.athenarc.historian.datasource.DataSourceException;
import gr.imsi.athenarc.historian.datasource.TagStore;
import gr.imsi.athenarc.historian.datasource.connection.ConnectionPool;
import gr.imsi.athenarc.historian.datasource.connection.ConnectionPoolException;
import gr.imsi.athenarc.historian.datasource.connection.DatabaseConnection;
import gr.imsi.athenarc.historian.datasource.connection.PooledConnection;
import gr.imsi.athenarc.historian.domain.AggregateInterval;
import gr.imsi.athenarc.historian.domain.Bucket;
import gr.imsi.athenarc.historian.domain.Tag;
import gr.imsi.athenarc.historian.domain.TimeRange;

/**
 * Reads the buckets of a tag in bounded chunks, one pooled connection per chunk. Every chunk
 * buckets on the grid that starts at the request start, so the chunks of one range join without
 * gaps or overlaps. A chunk that fails is skipped and the next one is read.
 *
 * @param <C> the connection type of the store
 */
public class ChunkedBucketFetcher<C extends DatabaseConnection> {

    private static final Logger LOG = LoggerFactory.getLogger(ChunkedBucketFetcher.class);

    public static final Duration DEFAULT_CHUNK_WIDTH = Duration.ofDays(1);

    private final TagStore<C> store;
    private final ConnectionPool<C> pool;
    private final Duration chunkWidth;
    private final FetchMode mode;

    public ChunkedBucketFetcher(TagStore<C> store, ConnectionPool<C> pool) {
        this(store, pool, DEFAULT_CHUNK_WIDTH, FetchMode.AGGREGATE);
    }

    public ChunkedBucketFetcher(TagStore<C> store, ConnectionPool<C> pool, Duration chunkWidth, FetchMode mode) {
        Preconditions.checkArgument(chunkWidth != null && chunkWidth.toMillis() > 0,
                "Chunk width must be positive, got %s", chunkWidth);
        Preconditions.checkArgument(mode != FetchMode.NATIVE_RESAMPLE || store.supportsNativeResampling(),
                "Native resampling is not supported by %s", store.getClass().getSimpleName());
        this.store = store;
        this.pool = pool;
        this.chunkWidth = chunkWidth;
        this.mode = mode;
    }

    /**
     * Returns the lazy chunk sequence of {@code tag} over {@code range}. Nothing is queried until
     * the sequence is iterated.
     */
    public ChunkedBucketSeries chunks(Tag tag, TimeRange range, AggregateInterval interval) {
        return new ChunkedBucketSeries(this, tag, range, interval, chunkWidth.toMillis());
    }

    /**
     * Reads all chunks of {@code tag} and joins their buckets in ascending order. Where two chunks
     * return the same timestamp the first one read is kept.
     *
     * @throws FetchCancelledException if the thread was interrupted before the last chunk
     */
    public TagSeries fetch(Tag tag, TimeRange range, AggregateInterval interval) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        List<Bucket> buckets = new ArrayList<>();
        int fetched = 0;
        int skipped = 0;
        for (ChunkResult chunk : chunks(tag, range, interval)) {
            if (chunk.isFetched()) {
                fetched++;
                buckets.addAll(chunk.getBuckets());
            } else {
                skipped++;
            }
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new FetchCancelledException("Fetch of " + tag + " was interrupted after "
                    + (fetched + skipped) + " chunks");
        }
        List<Bucket> unique = deduplicate(buckets);
        LOG.info("Fetched {} buckets of {} in {} ({} chunks read, {} skipped)", unique.size(), tag,
                stopwatch.stop(), fetched, skipped);
        return new TagSeries(tag, range, interval, unique, fetched, skipped);
    }

    /**
     * Sorts by timestamp and keeps the first bucket of every timestamp. The sort is stable, so
     * "first" means first in chunk order.
     */
    static List<Bucket> deduplicate(List<Bucket> buckets) {
        List<Bucket> sorted = new ArrayList<>(buckets);
        sorted.sort(Comparator.comparingLong(Bucket::getTimestamp));
        List<Bucket> unique = new ArrayList<>(sorted.size());
        for (Bucket bucket : sorted) {
            if (unique.isEmpty() || unique.get(unique.size() - 1).getTimestamp() != bucket.getTimestamp()) {
                unique.add(bucket);
            }
        }
        return unique;
    }

    ChunkResult fetchChunk(Tag tag, TimeRange window, long origin, long intervalMillis) {
        try (PooledConnection<C> lease = pool.acquire()) {
            try {
                List<Bucket> buckets = mode == FetchMode.NATIVE_RESAMPLE
                        ? store.resample(lease.get(), tag.getName(), window, intervalMillis)
                        : store.bucketAverages(lease.get(), tag.getName(), window, origin, intervalMillis);
                LOG.debug("Chunk {} of {}: {} buckets", window, tag, buckets.size());
                return ChunkResult.fetched(window, buckets);
            } catch (DataSourceException e) {
                lease.markBroken();
                LOG.warn("Skipping chunk {} of {}: {}", window, tag, e.getMessage());
                return ChunkResult.skipped(window, e.getMessage());
            } catch (RuntimeException e) {
                lease.markBroken();
                LOG.warn("Skipping chunk {} of {} after unexpected error", window, tag, e);
                return ChunkResult.skipped(window, e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        } catch (ConnectionPoolException e) {
            LOG.warn("Skipping chunk {} of {}: {}", window, tag, e.getMessage());
            return ChunkResult.skipped(window, e.getMessage());
        }
    }

    public FetchMode getMode() {
        return mode;
    }

    public Duration getChunkWidth() {
        return chunkWidth;
    }
}
