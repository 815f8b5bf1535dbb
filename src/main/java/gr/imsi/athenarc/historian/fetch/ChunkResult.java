package gr.imsi.athenarc.historian.fetch;

import java.util.Collections;
import java.util.List;

import gr.imsi.athenarc.historian.domain.Bucket;
import gr.imsi.athenarc.historian.domain.TimeRange;

/**
 * Outcome of reading one chunk of a tag's range.
 */
public final class ChunkResult {

    public enum Status {
        FETCHED,
        SKIPPED
    }

    private final Status status;
    private final TimeRange window;
    private final List<Bucket> buckets;
    private final String reason;

    private ChunkResult(Status status, TimeRange window, List<Bucket> buckets, String reason) {
        this.status = status;
        this.window = window;
        this.buckets = buckets;
        this.reason = reason;
    }

    public static ChunkResult fetched(TimeRange window, List<Bucket> buckets) {
        return new ChunkResult(Status.FETCHED, window, Collections.unmodifiableList(buckets), null);
    }

    public static ChunkResult skipped(TimeRange window, String reason) {
        return new ChunkResult(Status.SKIPPED, window, Collections.emptyList(), reason);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isFetched() {
        return status == Status.FETCHED;
    }

    public TimeRange getWindow() {
        return window;
    }

    /**
     * @return the ascending buckets of the chunk, empty when skipped
     */
    public List<Bucket> getBuckets() {
        return buckets;
    }

    /**
     * @return why the chunk was skipped, {@code null} when fetched
     */
    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return isFetched()
                ? "ChunkResult{FETCHED " + window + ", " + buckets.size() + " buckets}"
                : "ChunkResult{SKIPPED " + window + ", " + reason + "}";
    }
}
