package gr.imsi.athenarc.historian.fetch;

import java.util.Iterator;
import java.util.NoSuchElementException;

import org.jetbrains.annotations.NotNull;

import gr.imsi.athenarc.historian.domain.AggregateInterval;
import gr.imsi.athenarc.historian.domain.DateTimeUtil;
import gr.imsi.athenarc.historian.domain.Tag;
import gr.imsi.athenarc.historian.domain.TimeRange;

/**
 * The chunks of one tag's range, read lazily in time order. Each chunk is queried when the
 * iterator reaches it and every new iterator queries the store again. Iteration ends early when
 * the current thread is interrupted.
 */
public class ChunkedBucketSeries implements Iterable<ChunkResult> {

    private final ChunkedBucketFetcher<?> fetcher;
    private final Tag tag;
    private final TimeRange range;
    private final AggregateInterval interval;
    private final long chunkWidth;

    ChunkedBucketSeries(ChunkedBucketFetcher<?> fetcher, Tag tag, TimeRange range, AggregateInterval interval,
                        long chunkWidth) {
        this.fetcher = fetcher;
        this.tag = tag;
        this.range = range;
        this.interval = interval;
        this.chunkWidth = DateTimeUtil.alignChunkWidth(chunkWidth, interval.toMillis());
    }

    public Tag getTag() {
        return tag;
    }

    public TimeRange getRange() {
        return range;
    }

    /**
     * @return the chunk width actually used, a whole number of intervals
     */
    public long getChunkWidth() {
        return chunkWidth;
    }

    @NotNull
    @Override
    public Iterator<ChunkResult> iterator() {
        return new Iterator<ChunkResult>() {
            private long cursor = range.getFrom();

            @Override
            public boolean hasNext() {
                return cursor < range.getTo() && !Thread.currentThread().isInterrupted();
            }

            @Override
            public ChunkResult next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                long end = Math.min(cursor + chunkWidth, range.getTo());
                TimeRange window = new TimeRange(cursor, end);
                cursor = end;
                return fetcher.fetchChunk(tag, window, range.getFrom(), interval.toMillis());
            }
        };
    }
}
