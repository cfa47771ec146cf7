package com.forenx.sentinel.query;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Half-open time range {@code [from, to)} used by every query.
 * Bounds are accepted as ISO-8601 instants, offset date-times or epoch milliseconds.
 */
public final class TimeRange {

    private final Instant from;
    private final Instant to;

    public TimeRange(Instant from, Instant to) {
        this.from = from;
        this.to = to;
    }

    /**
     * @throws QueryValidationException if a bound is missing or unparseable, or {@code to} precedes {@code from}
     */
    public static TimeRange parse(String from, String to) {
        Instant start = parseBound("from", from);
        Instant end = parseBound("to", to);
        if (end.isBefore(start)) {
            throw new QueryValidationException("to", "'to' (" + end + ") is before 'from' (" + start + ")");
        }
        return new TimeRange(start, end);
    }

    static Instant parseBound(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new QueryValidationException(name, "Missing required parameter '" + name + "'");
        }
        String v = value.trim();
        if (v.chars().allMatch(Character::isDigit)) {
            try {
                return Instant.ofEpochMilli(Long.parseLong(v));
            } catch (NumberFormatException e) {
                throw new QueryValidationException(name, "Parameter '" + name + "' is out of range: " + v, e);
            }
        }
        try {
            return Instant.parse(v);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(v).toInstant();
            } catch (DateTimeParseException e2) {
                throw new QueryValidationException(name, "Parameter '" + name + "' is not a timestamp: " + v, e2);
            }
        }
    }

    public Instant getFrom() {
        return from;
    }

    public Instant getTo() {
        return to;
    }

    public Duration length() {
        return Duration.between(from, to);
    }

    @Override
    public String toString() {
        return "[" + from + ", " + to + ")";
    }
}
