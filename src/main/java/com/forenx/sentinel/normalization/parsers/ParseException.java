package com.forenx.sentinel.normalization.parsers;

import com.forenx.sentinel.domain.ErrorKind;
import com.forenx.sentinel.domain.SentinelException;

/**
 * Exception thrown when a raw line cannot be parsed into a record.
 * Carries the failure classification and the format that was being applied, if any.
 */
public class ParseException extends SentinelException {

    private static final int MAX_RAW_LENGTH = 512;

    private final ParseErrorKind kind;
    private final String formatName;
    private final String rawData;

    public ParseException(ParseErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public ParseException(ParseErrorKind kind, String message, String formatName, String rawData) {
        super(message);
        this.kind = kind;
        this.formatName = formatName;
        this.rawData = truncate(rawData);
    }

    public ParseException(ParseErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.formatName = null;
        this.rawData = null;
    }

    /**
     * Returns a copy of this exception that names the format and raw line it occurred on.
     */
    public ParseException withContext(String formatName, String rawData) {
        ParseException copy = new ParseException(kind, getMessage(), formatName, rawData);
        copy.initCause(getCause());
        return copy;
    }

    private static String truncate(String raw) {
        if (raw == null || raw.length() <= MAX_RAW_LENGTH) {
            return raw;
        }
        return raw.substring(0, MAX_RAW_LENGTH) + "...";
    }

    public ParseErrorKind getKind() {
        return kind;
    }

    public String getFormatName() {
        return formatName;
    }

    public String getRawData() {
        return rawData;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.PARSE_ERROR;
    }
}
