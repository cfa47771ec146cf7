package com.forenx.sentinel.normalization.parsers;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parses the timestamp notations found in web-server logs into UTC instants with
 * millisecond precision. Zone-less notations are interpreted as UTC.
 */
public final class TimestampParser {

    private static final List<DateTimeFormatter> OFFSET_FORMATS = List.of(
        DateTimeFormatter.ofPattern("dd/MMM/yyyy:HH:mm:ss Z", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("dd/MMM/yyyy:HH:mm:ss.SSS Z", Locale.ENGLISH),
        DateTimeFormatter.ISO_OFFSET_DATE_TIME
    );

    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
        DateTimeFormatter.ofPattern("dd/MMM/yyyy:HH:mm:ss", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss", Locale.ENGLISH),
        DateTimeFormatter.ISO_LOCAL_DATE_TIME
    );

    // Epoch values above this are milliseconds (year 5138 in seconds)
    private static final BigDecimal MILLIS_THRESHOLD = BigDecimal.valueOf(100_000_000_000L);

    private static final BigDecimal MAX_EPOCH_MILLIS = BigDecimal.valueOf(Long.MAX_VALUE);

    private static final Pattern EPOCH_PATTERN = Pattern.compile("-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?");

    private TimestampParser() {
    }

    /**
     * Parse a textual timestamp.
     *
     * @throws ParseException with kind {@link ParseErrorKind#INVALID_TIMESTAMP} when no notation fits
     */
    public static Instant parse(String text) throws ParseException {
        if (text == null || text.isBlank() || "-".equals(text.trim())) {
            throw new ParseException(ParseErrorKind.INVALID_TIMESTAMP, "Missing timestamp");
        }
        String value = text.trim();

        if (isNumeric(value)) {
            return parseEpoch(value);
        }

        for (DateTimeFormatter formatter : OFFSET_FORMATS) {
            try {
                return OffsetDateTime.parse(value, formatter).toInstant().truncatedTo(ChronoUnit.MILLIS);
            } catch (DateTimeParseException e) {
                // try next notation
            }
        }

        for (DateTimeFormatter formatter : LOCAL_FORMATS) {
            try {
                return LocalDateTime.parse(value, formatter).toInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS);
            } catch (DateTimeParseException e) {
                // try next notation
            }
        }

        throw new ParseException(ParseErrorKind.INVALID_TIMESTAMP, "Unrecognised timestamp: " + value);
    }

    /**
     * Parse epoch seconds (optionally fractional or in exponent notation) or epoch milliseconds.
     * Integral values at or above year 5138 in seconds are read as milliseconds.
     */
    public static Instant parseEpoch(String value) throws ParseException {
        BigDecimal epoch;
        try {
            epoch = new BigDecimal(value);
        } catch (NumberFormatException e) {
            throw new ParseException(ParseErrorKind.INVALID_TIMESTAMP, "Invalid epoch timestamp: " + value, e);
        }
        if (epoch.signum() < 0) {
            throw new ParseException(ParseErrorKind.INVALID_TIMESTAMP, "Negative epoch timestamp: " + value);
        }
        try {
            BigDecimal millis = isIntegral(epoch) && epoch.compareTo(MILLIS_THRESHOLD) >= 0
                ? epoch
                : epoch.movePointRight(3);
            if (millis.compareTo(MAX_EPOCH_MILLIS) > 0) {
                throw new ParseException(ParseErrorKind.INVALID_TIMESTAMP, "Epoch timestamp out of range: " + value);
            }
            return Instant.ofEpochMilli(millis.setScale(0, RoundingMode.HALF_UP).longValueExact());
        } catch (ArithmeticException e) {
            throw new ParseException(ParseErrorKind.INVALID_TIMESTAMP, "Epoch timestamp out of range: " + value, e);
        }
    }

    private static boolean isIntegral(BigDecimal value) {
        return value.stripTrailingZeros().scale() <= 0;
    }

    private static boolean isNumeric(String value) {
        return EPOCH_PATTERN.matcher(value).matches();
    }
}
