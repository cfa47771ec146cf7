package com.forenx.sentinel.analytics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Time-bucket sizes for metrics. Buckets are aligned in UTC; weeks start on Monday.
 */
public enum Granularity {
    HOUR("hour"),
    DAY("day"),
    WEEK("week"),
    MONTH("month");

    private final String value;

    Granularity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Instant bucketStart(Instant instant) {
        ZonedDateTime t = instant.atZone(ZoneOffset.UTC);
        switch (this) {
            case HOUR:
                return t.truncatedTo(ChronoUnit.HOURS).toInstant();
            case DAY:
                return t.truncatedTo(ChronoUnit.DAYS).toInstant();
            case WEEK:
                return t.truncatedTo(ChronoUnit.DAYS)
                    .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).toInstant();
            case MONTH:
                return t.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1).toInstant();
            default:
                throw new IllegalStateException("Unhandled granularity " + this);
        }
    }

    /**
     * Start of the bucket following the one starting at {@code bucketStart}.
     */
    public Instant next(Instant bucketStart) {
        ZonedDateTime t = bucketStart.atZone(ZoneOffset.UTC);
        switch (this) {
            case HOUR:
                return t.plusHours(1).toInstant();
            case DAY:
                return t.plusDays(1).toInstant();
            case WEEK:
                return t.plusWeeks(1).toInstant();
            case MONTH:
                return t.plusMonths(1).toInstant();
            default:
                throw new IllegalStateException("Unhandled granularity " + this);
        }
    }

    public boolean isAligned(Instant instant) {
        return bucketStart(instant).equals(instant);
    }

    @JsonCreator
    public static Granularity fromValue(String value) {
        for (Granularity g : values()) {
            if (g.value.equalsIgnoreCase(value) || g.name().equalsIgnoreCase(value)) {
                return g;
            }
        }
        throw new IllegalArgumentException("Unknown granularity: " + value);
    }
}
