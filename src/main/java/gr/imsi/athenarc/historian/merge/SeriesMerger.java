package gr.imsi.athenarc.historian.merge;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.historian.domain.Bucket;
import gr.imsi.athenarc.historian.domain.DateTimeUtil;
import gr.imsi.athenarc.historian.domain.Tag;
import gr.imsi.athenarc.historian.fetch.TagSeries;

/**
 * Outer-joins tag series on their bucket timestamps and fills the gaps.
 */
public class SeriesMerger {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesMerger.class);

    private final FillPolicy fillPolicy;

    public SeriesMerger() {
        this(FillPolicy.FORWARD_BACKWARD);
    }

    public SeriesMerger(FillPolicy fillPolicy) {
        this.fillPolicy = fillPolicy;
    }

    /**
     * Builds one table with a column per series that has data, in input order. Series without
     * buckets are reported through {@link MergedTable#getExcludedTags()}.
     *
     * @throws MergeException if a series is not strictly ascending or holds a bucket off the
     *         grid of its request
     */
    public MergedTable merge(List<TagSeries> series) {
        List<TagSeries> included = new ArrayList<>();
        List<Tag> columns = new ArrayList<>();
        List<Tag> excluded = new ArrayList<>();
        TreeSet<Long> index = new TreeSet<>();
        for (TagSeries s : series) {
            if (!s.hasData()) {
                LOG.warn("No data for tag {}, leaving it out of the table", s.getTag());
                excluded.add(s.getTag());
                continue;
            }
            check(s);
            included.add(s);
            columns.add(s.getTag());
            for (Bucket bucket : s.getBuckets()) {
                index.add(bucket.getTimestamp());
            }
        }

        long[] timestamps = new long[index.size()];
        int i = 0;
        for (Long timestamp : index) {
            timestamps[i++] = timestamp;
        }

        double[][] values = new double[included.size()][];
        for (int c = 0; c < included.size(); c++) {
            double[] column = new double[timestamps.length];
            Arrays.fill(column, Double.NaN);
            for (Bucket bucket : included.get(c).getBuckets()) {
                column[Arrays.binarySearch(timestamps, bucket.getTimestamp())] = bucket.getValue();
            }
            fillPolicy.fill(column);
            values[c] = column;
        }
        LOG.info("Merged {} tags into {} rows", columns.size(), timestamps.length);
        return new MergedTable(timestamps, columns, values, excluded);
    }

    private static void check(TagSeries s) {
        long origin = s.getRange().getFrom();
        long width = s.getInterval().toMillis();
        Long previous = null;
        for (Bucket bucket : s.getBuckets()) {
            long timestamp = bucket.getTimestamp();
            if (previous != null && timestamp <= previous) {
                throw new MergeException("Buckets of " + s.getTag() + " are not strictly ascending at "
                        + DateTimeUtil.format(timestamp));
            }
            if (!DateTimeUtil.isAligned(origin, width, timestamp)) {
                throw new MergeException("Bucket " + DateTimeUtil.format(timestamp) + " of " + s.getTag()
                        + " is not aligned to the " + s.getInterval() + " grid starting at "
                        + DateTimeUtil.format(origin));
            }
            previous = timestamp;
        }
    }

    public FillPolicy getFillPolicy() {
        return fillPolicy;
    }
}
