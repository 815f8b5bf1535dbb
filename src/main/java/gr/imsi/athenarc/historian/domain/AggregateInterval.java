package gr.imsi.athenarc.historian.domain;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Represents the width of an aggregation bucket. Widths are whole seconds and strictly positive.
 */
public class AggregateInterval implements Comparable<AggregateInterval> {

    private final long multiplier;
    private final ChronoUnit chronoUnit;

    private AggregateInterval(long multiplier, ChronoUnit chronoUnit) {
        this.multiplier = multiplier;
        this.chronoUnit = chronoUnit;
    }

    public long getMultiplier() {
        return multiplier;
    }

    public ChronoUnit getChronoUnit() {
        return chronoUnit;
    }

    public Duration toDuration() {
        return Duration.of(multiplier, chronoUnit);
    }

    public long toMillis() {
        return toDuration().toMillis();
    }

    @Override
    public String toString() {
        return "AggregateInterval{" +
                multiplier +
                " " +
                chronoUnit +
                '}';
    }

    @Override
    public int compareTo(AggregateInterval o) {
        return Long.compare(this.toMillis(), o.toMillis());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregateInterval)) return false;
        return toMillis() == ((AggregateInterval) o).toMillis();
    }

    @Override
    public int hashCode() {
        return Objects.hash(toMillis());
    }

    /**
     * @throws IllegalArgumentException if the resulting width is not a positive number of whole seconds
     */
    public static AggregateInterval of(long multiplier, ChronoUnit chronoUnit) {
        if (multiplier <= 0) {
            throw new IllegalArgumentException("Interval must be positive, got " + multiplier + " " + chronoUnit);
        }
        AggregateInterval interval = new AggregateInterval(multiplier, chronoUnit);
        Duration duration = interval.toDuration();
        if (duration.getNano() != 0) {
            throw new IllegalArgumentException("Interval must be a whole number of seconds, got " + duration);
        }
        return interval;
    }

    public static AggregateInterval of(Duration duration) {
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("Interval must be positive, got " + duration);
        }
        return of(duration.toMillis(), ChronoUnit.MILLIS);
    }

    /**
     * Parses the frequency as entered by users, {@code HH:MM:SS} or an ISO-8601 duration.
     */
    public static AggregateInterval parse(String frequency) {
        return of(DateTimeUtil.parseDuration(frequency));
    }
}
