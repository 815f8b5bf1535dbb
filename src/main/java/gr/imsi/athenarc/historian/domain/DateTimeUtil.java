package gr.imsi.athenarc.historian.domain;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

import com.google.common.base.Preconditions;


public class DateTimeUtil {

    public static final ZoneId UTC = ZoneId.of("UTC");
    public final static String DEFAULT_FORMAT = "yyyy-MM-dd[ HH:mm:ss]";
    public final static DateTimeFormatter DEFAULT_FORMATTER = DateTimeFormatter.ofPattern(DEFAULT_FORMAT);
    public final static DateTimeFormatter EXPORT_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private DateTimeUtil() {}

    public static long parseDateTimeString(String s, String timeFormat) {
        DateTimeFormatter formatter = DateTimeFormatter.ofPattern(timeFormat);
        return parseDateTimeStringInternal(s, formatter, UTC);
    }

    public static long parseDateTimeString(String s, DateTimeFormatter formatter) {
        return parseDateTimeStringInternal(s, formatter, UTC);
    }

    public static long parseDateTimeString(String s) {
        return parseDateTimeStringInternal(s, DEFAULT_FORMATTER, UTC);
    }

    private static long parseDateTimeStringInternal(String s, DateTimeFormatter formatter, ZoneId zoneId) {
        String trimmed = s.trim();
        try {
            // Try parsing as LocalDateTime
            return LocalDateTime.parse(trimmed, formatter).atZone(zoneId).toInstant().toEpochMilli();
        } catch (DateTimeParseException e) {
            // If parsing as LocalDateTime fails, try parsing as LocalDate
            return LocalDate.parse(trimmed, formatter).atStartOfDay(zoneId).toInstant().toEpochMilli();
        }
    }

    public static String format(final long timeStamp) {
        return format(timeStamp, EXPORT_FORMATTER);
    }

    public static String format(final long timeStamp, final String format) {
        return format(timeStamp, DateTimeFormatter.ofPattern(format));
    }

    public static String format(final long timeStamp, final DateTimeFormatter formatter) {
        return Instant.ofEpochMilli(timeStamp)
                .atZone(UTC)
                .format(formatter);
    }

    /**
     * Historian timestamps are wall-clock values without a zone. They are handled as UTC epoch
     * milliseconds throughout, so the conversion to the driver's {@link LocalDateTime} is lossless.
     */
    public static LocalDateTime toLocalDateTime(long timeStamp) {
        return LocalDateTime.ofEpochSecond(Math.floorDiv(timeStamp, 1000L),
                (int) Math.floorMod(timeStamp, 1000L) * 1_000_000, ZoneOffset.UTC);
    }

    public static long fromLocalDateTime(LocalDateTime dateTime) {
        return dateTime.toInstant(ZoneOffset.UTC).toEpochMilli();
    }

    /**
     * Start of the bucket that contains {@code timestamp} on the grid {@code origin + k * width}.
     * Timestamps before the origin fall into buckets with negative {@code k}.
     *
     * @param origin reference instant shared by every chunk of a request
     * @param width bucket width in milliseconds
     * @param timestamp the instant to place
     * @return the bucket start, always {@code <= timestamp}
     */
    public static long bucketStart(long origin, long width, long timestamp) {
        Preconditions.checkArgument(width > 0, "Bucket width must be positive, got %s", width);
        return origin + Math.floorDiv(timestamp - origin, width) * width;
    }

    public static boolean isAligned(long origin, long width, long timestamp) {
        return bucketStart(origin, width, timestamp) == timestamp;
    }

    /**
     * Rounds a chunk width down to a whole number of buckets, never below one bucket, so that
     * chunk seams fall on bucket boundaries.
     */
    public static long alignChunkWidth(long chunkWidth, long bucketWidth) {
        Preconditions.checkArgument(chunkWidth > 0, "Chunk width must be positive, got %s", chunkWidth);
        Preconditions.checkArgument(bucketWidth > 0, "Bucket width must be positive, got %s", bucketWidth);
        return Math.max(bucketWidth, (chunkWidth / bucketWidth) * bucketWidth);
    }

    /**
     * Parses {@code HH:MM:SS} (hours may exceed 23) or an ISO-8601 duration such as {@code PT10M}.
     */
    public static Duration parseDuration(String s) {
        Preconditions.checkArgument(s != null && !s.isBlank(), "Duration must not be empty");
        String trimmed = s.trim();
        if (trimmed.startsWith("P") || trimmed.startsWith("p")) {
            try {
                return Duration.parse(trimmed.toUpperCase());
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid duration: " + s, e);
            }
        }
        String[] parts = trimmed.split(":");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Invalid time format. Expected HH:MM:SS, got " + s);
        }
        try {
            long hours = Long.parseLong(parts[0]);
            long minutes = Long.parseLong(parts[1]);
            long seconds = Long.parseLong(parts[2]);
            if (hours < 0 || minutes < 0 || minutes > 59 || seconds < 0 || seconds > 59) {
                throw new IllegalArgumentException("Invalid time format. Expected HH:MM:SS, got " + s);
            }
            return Duration.ofHours(hours).plusMinutes(minutes).plusSeconds(seconds);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid time format. Expected HH:MM:SS, got " + s, e);
        }
    }
}
