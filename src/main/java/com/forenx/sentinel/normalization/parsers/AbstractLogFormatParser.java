package com.forenx.sentinel.normalization.parsers;

import com.forenx.sentinel.domain.LogRecord;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Field conversions shared by the format parsers. Every conversion either yields a
 * valid value or throws; nothing is clamped or defaulted.
 */
public abstract class AbstractLogFormatParser implements LogFormatParser {

    private final String formatName;
    private final int priority;

    protected AbstractLogFormatParser(String formatName, int priority) {
        this.formatName = formatName;
        this.priority = priority;
    }

    @Override
    public String getFormatName() {
        return formatName;
    }

    @Override
    public int getPriority() {
        return priority;
    }

    protected int parseStatus(String value) throws ParseException {
        if (value == null || value.isBlank()) {
            throw new ParseException(ParseErrorKind.INVALID_STATUS_CODE, "Missing status code");
        }
        int status;
        try {
            status = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ParseException(ParseErrorKind.INVALID_STATUS_CODE, "Non-numeric status code: " + value, e);
        }
        if (status < 100 || status > 599) {
            throw new ParseException(ParseErrorKind.INVALID_STATUS_CODE, "Status code out of range: " + status);
        }
        return status;
    }

    /**
     * Common Log Format writes "-" for a response without body, which is zero bytes.
     */
    protected long parseBytes(String value) throws ParseException {
        if (value == null || value.isBlank() || "-".equals(value.trim())) {
            return 0L;
        }
        long bytes;
        try {
            bytes = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ParseException(ParseErrorKind.INVALID_NUMERIC_FIELD, "Non-numeric byte count: " + value, e);
        }
        if (bytes < 0) {
            throw new ParseException(ParseErrorKind.INVALID_NUMERIC_FIELD, "Negative byte count: " + bytes);
        }
        return bytes;
    }

    /**
     * nginx logs {@code $request_time} in fractional seconds.
     */
    protected Long parseRequestTimeSeconds(String value) throws ParseException {
        if (value == null || value.isBlank() || "-".equals(value.trim())) {
            return null;
        }
        try {
            double seconds = Double.parseDouble(value.trim());
            if (seconds < 0 || Double.isNaN(seconds) || Double.isInfinite(seconds)) {
                throw new ParseException(ParseErrorKind.INVALID_NUMERIC_FIELD, "Invalid request time: " + value);
            }
            return Math.round(seconds * 1000.0);
        } catch (NumberFormatException e) {
            throw new ParseException(ParseErrorKind.INVALID_NUMERIC_FIELD, "Non-numeric request time: " + value, e);
        }
    }

    /**
     * Split a request line such as {@code GET /a?b=1 HTTP/1.1}. Unencoded spaces inside
     * the target (common in injection attempts) are kept as part of the target.
     */
    protected void applyRequestLine(LogRecord.Builder builder, String request) {
        if (request == null || request.isBlank() || "-".equals(request.trim())) {
            applyTarget(builder, "");
            return;
        }
        String[] parts = request.trim().split(" ");
        builder.method(parts[0]);
        if (parts.length == 1) {
            applyTarget(builder, "");
            return;
        }
        int targetEnd = parts.length;
        if (parts.length > 2 && parts[parts.length - 1].startsWith("HTTP/")) {
            builder.protocolVersion(parts[parts.length - 1]);
            targetEnd = parts.length - 1;
        }
        StringBuilder target = new StringBuilder(parts[1]);
        for (int i = 2; i < targetEnd; i++) {
            target.append(' ').append(parts[i]);
        }
        applyTarget(builder, target.toString());
    }

    /**
     * Split a request target into decoded path and raw query.
     */
    protected void applyTarget(LogRecord.Builder builder, String target) {
        if (target == null) {
            target = "";
        }
        int question = target.indexOf('?');
        String rawPath = question >= 0 ? target.substring(0, question) : target;
        String query = question >= 0 ? target.substring(question + 1) : "";
        builder.path(decodePath(rawPath));
        builder.query(query);
    }

    /**
     * Percent-decode a path. '+' is literal in paths. Malformed escapes leave the path as logged.
     */
    static String decodePath(String rawPath) {
        if (rawPath.indexOf('%') < 0) {
            return rawPath;
        }
        try {
            return URLDecoder.decode(rawPath.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return rawPath;
        }
    }

    protected static String blankToNull(String value) {
        if (value == null || value.isEmpty() || "-".equals(value)) {
            return null;
        }
        return value;
    }
}
