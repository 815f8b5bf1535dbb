package gr.imsi.athenarc.historian.domain;

import java.util.Objects;

/**
 * Half-open interval {@code [from, to)} of epoch milliseconds.
 */
public class TimeRange {

    private final long from;
    private final long to;

    public TimeRange(long from, long to) {
        if (from >= to) {
            throw new IllegalArgumentException("Time range start " + DateTimeUtil.format(from)
                    + " must be before end " + DateTimeUtil.format(to));
        }
        this.from = from;
        this.to = to;
    }

    public long getFrom() {
        return from;
    }

    public long getTo() {
        return to;
    }

    public long length() {
        return to - from;
    }

    public boolean contains(long timestamp) {
        return timestamp >= from && timestamp < to;
    }

    public String getFromDate() {
        return DateTimeUtil.format(from);
    }

    public String getToDate() {
        return DateTimeUtil.format(to);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeRange)) return false;
        TimeRange that = (TimeRange) o;
        return from == that.from && to == that.to;
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to);
    }

    @Override
    public String toString() {
        return "[" + getFromDate() + ", " + getToDate() + ")";
    }
}
