package gr.imsi.athenarc.historian.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.LocalDateTime;

import org.junit.jupiter.api.Test;

public class DateTimeUtilTest {

    private static final long MINUTE = 60_000L;

    @Test
    public void testBucketStartOnBoundaries() {
        long origin = 1_000L;
        assertEquals(origin, DateTimeUtil.bucketStart(origin, MINUTE, origin));
        assertEquals(origin, DateTimeUtil.bucketStart(origin, MINUTE, origin + MINUTE - 1));
        assertEquals(origin + MINUTE, DateTimeUtil.bucketStart(origin, MINUTE, origin + MINUTE));
        assertEquals(origin + 5 * MINUTE, DateTimeUtil.bucketStart(origin, MINUTE, origin + 5 * MINUTE + 30_000));
    }

    @Test
    public void testBucketStartBeforeOrigin() {
        long origin = 10 * MINUTE;
        assertEquals(9 * MINUTE, DateTimeUtil.bucketStart(origin, MINUTE, origin - 1));
        assertEquals(8 * MINUTE, DateTimeUtil.bucketStart(origin, MINUTE, origin - MINUTE - 1));
    }

    @Test
    public void testBucketStartRejectsNonPositiveWidth() {
        assertThrows(IllegalArgumentException.class, () -> DateTimeUtil.bucketStart(0, 0, 10));
    }

    @Test
    public void testIsAligned() {
        assertTrue(DateTimeUtil.isAligned(500, 100, 800));
        assertFalse(DateTimeUtil.isAligned(500, 100, 850));
    }

    @Test
    public void testAlignChunkWidth() {
        long hour = 60 * MINUTE;
        assertEquals(24 * hour, DateTimeUtil.alignChunkWidth(24 * hour, 6 * hour));
        assertEquals(21 * hour, DateTimeUtil.alignChunkWidth(24 * hour, 7 * hour));
        assertEquals(7 * hour, DateTimeUtil.alignChunkWidth(hour, 7 * hour));
    }

    @Test
    public void testParseDateTimeString() {
        long expected = DateTimeUtil.fromLocalDateTime(LocalDateTime.of(2024, 3, 1, 12, 30, 15));
        assertEquals(expected, DateTimeUtil.parseDateTimeString("2024-03-01 12:30:15"));
        assertEquals(DateTimeUtil.fromLocalDateTime(LocalDateTime.of(2024, 3, 1, 0, 0)),
                DateTimeUtil.parseDateTimeString(" 2024-03-01 "));
    }

    @Test
    public void testFormatIsUtc() {
        assertEquals("1970-01-01 00:01:00", DateTimeUtil.format(MINUTE));
    }

    @Test
    public void testLocalDateTimeConversion() {
        long timestamp = 1_700_000_000_123L;
        LocalDateTime dateTime = DateTimeUtil.toLocalDateTime(timestamp);
        assertEquals(123_000_000, dateTime.getNano());
        assertEquals(timestamp, DateTimeUtil.fromLocalDateTime(dateTime));
        assertEquals(-1L, DateTimeUtil.fromLocalDateTime(DateTimeUtil.toLocalDateTime(-1L)));
    }

    @Test
    public void testParseDuration() {
        assertEquals(Duration.ofMinutes(1), DateTimeUtil.parseDuration("00:01:00"));
        assertEquals(Duration.ofHours(36).plusSeconds(5), DateTimeUtil.parseDuration("36:00:05"));
        assertEquals(Duration.ofMinutes(10), DateTimeUtil.parseDuration("PT10M"));
        assertEquals(Duration.ofDays(1), DateTimeUtil.parseDuration("P1D"));
        assertThrows(IllegalArgumentException.class, () -> DateTimeUtil.parseDuration("10:61:00"));
        assertThrows(IllegalArgumentException.class, () -> DateTimeUtil.parseDuration("ten minutes"));
        assertThrows(IllegalArgumentException.class, () -> DateTimeUtil.parseDuration(" "));
    }
}
