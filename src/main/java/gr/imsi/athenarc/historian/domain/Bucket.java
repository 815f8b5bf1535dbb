package gr.imsi.athenarc.historian.domain;

import java.util.Objects;

/**
 * An aggregated value for the bucket starting at {@code timestamp}.
 */
public final class Bucket {

    private final long timestamp;
    private final double value;

    public Bucket(long timestamp, double value) {
        this.timestamp = timestamp;
        this.value = value;
    }

    /**
     * Returns the bucket start (epoch time in milliseconds).
     */
    public long getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bucket)) return false;
        Bucket bucket = (Bucket) o;
        return timestamp == bucket.timestamp && Double.compare(value, bucket.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return "{" + DateTimeUtil.format(timestamp) + ", " + value + "}";
    }
}
