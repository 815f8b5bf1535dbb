package gr.imsi.athenarc.historian.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

import org.junit.jupiter.api.Test;

public class AggregateIntervalTest {

    @Test
    public void testParseFrequency() {
        assertEquals(60_000L, AggregateInterval.parse("00:01:00").toMillis());
        assertEquals(6 * 3_600_000L, AggregateInterval.parse("PT6H").toMillis());
    }

    @Test
    public void testEqualityByWidth() {
        assertEquals(AggregateInterval.of(1, ChronoUnit.HOURS), AggregateInterval.of(60, ChronoUnit.MINUTES));
        assertEquals(AggregateInterval.of(1, ChronoUnit.HOURS).hashCode(),
                AggregateInterval.of(Duration.ofMinutes(60)).hashCode());
        assertTrue(AggregateInterval.of(1, ChronoUnit.MINUTES).compareTo(AggregateInterval.of(1, ChronoUnit.HOURS)) < 0);
    }

    @Test
    public void testRejectsInvalidWidths() {
        assertThrows(IllegalArgumentException.class, () -> AggregateInterval.of(0, ChronoUnit.SECONDS));
        assertThrows(IllegalArgumentException.class, () -> AggregateInterval.of(-5, ChronoUnit.MINUTES));
        assertThrows(IllegalArgumentException.class, () -> AggregateInterval.of(500, ChronoUnit.MILLIS));
        assertThrows(IllegalArgumentException.class, () -> AggregateInterval.parse("00:00:00"));
    }
}
