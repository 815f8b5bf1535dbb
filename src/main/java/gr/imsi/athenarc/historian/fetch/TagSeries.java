package gr.imsi.athenarc.historian.fetch;

import java.util.Collections;
import java.util.List;

import gr.imsi.athenarc.historian.domain.AggregateInterval;
import gr.imsi.athenarc.historian.domain.Bucket;
import gr.imsi.athenarc.historian.domain.Tag;
import gr.imsi.athenarc.historian.domain.TimeRange;

/**
 * The buckets of one tag over a request range, ascending and unique by timestamp.
 */
public class TagSeries {

    private final Tag tag;
    private final TimeRange range;
    private final AggregateInterval interval;
    private final List<Bucket> buckets;
    private final int fetchedChunks;
    private final int skippedChunks;

    public TagSeries(Tag tag, TimeRange range, AggregateInterval interval, List<Bucket> buckets,
                     int fetchedChunks, int skippedChunks) {
        this.tag = tag;
        this.range = range;
        this.interval = interval;
        this.buckets = Collections.unmodifiableList(buckets);
        this.fetchedChunks = fetchedChunks;
        this.skippedChunks = skippedChunks;
    }

    public Tag getTag() {
        return tag;
    }

    public TimeRange getRange() {
        return range;
    }

    public AggregateInterval getInterval() {
        return interval;
    }

    public List<Bucket> getBuckets() {
        return buckets;
    }

    public int getFetchedChunks() {
        return fetchedChunks;
    }

    public int getSkippedChunks() {
        return skippedChunks;
    }

    public boolean hasData() {
        return !buckets.isEmpty();
    }

    @Override
    public String toString() {
        return "TagSeries{" +
                "tag=" + tag +
                ", range=" + range +
                ", buckets=" + buckets.size() +
                ", fetchedChunks=" + fetchedChunks +
                ", skippedChunks=" + skippedChunks +
                '}';
    }
}
