package com.di.accesslogs.partition;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * An hourly partition {@code (year, month, day, hour)} in UTC, each field zero-padded
 * ({@code 2022}, {@code 07}, {@code 20}, {@code 13}) exactly as it appears in object keys and
 * partition values.
 */
public record PartitionHour(String year, String month, String day, String hour) {

    /** The partition containing {@code instant} (UTC). */
    public static PartitionHour of(Instant instant) {
        ZonedDateTime utc = instant.atZone(ZoneOffset.UTC);
        return of(utc.getYear(), utc.getMonthValue(), utc.getDayOfMonth(), utc.getHour());
    }

    /**
     * @throws IllegalArgumentException if the fields do not form a valid UTC hour
     */
    public static PartitionHour of(int year, int month, int day, int hour) {
        try {
            ZonedDateTime.of(year, month, day, hour, 0, 0, 0, ZoneOffset.UTC);
        } catch (java.time.DateTimeException e) {
            throw new IllegalArgumentException("Invalid partition hour: " + e.getMessage(), e);
        }
        return new PartitionHour(
                String.format("%04d", year),
                String.format("%02d", month),
                String.format("%02d", day),
                String.format("%02d", hour));
    }

    /** The partition {@code hours} before or after the one containing {@code instant}. */
    public static PartitionHour offset(Instant instant, long hours) {
        return of(instant.plus(hours, ChronoUnit.HOURS));
    }

    /** Folder of this partition below {@code tableFolder}, with trailing slash. */
    public String location(String tableFolder) {
        return String.format("%s/year=%s/month=%s/day=%s/hour=%s/", tableFolder, year, month, day, hour);
    }

    @Override
    public String toString() {
        return String.format("year=%s/month=%s/day=%s/hour=%s", year, month, day, hour);
    }
}
