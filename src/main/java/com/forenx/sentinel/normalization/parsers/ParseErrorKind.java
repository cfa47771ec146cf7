package com.forenx.sentinel.normalization.parsers;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a raw line could not become a {@link com.forenx.sentinel.domain.LogRecord}.
 */
public enum ParseErrorKind {

    UNMATCHED_FORMAT("UnmatchedFormat"),

    INVALID_TIMESTAMP("InvalidTimestamp"),

    INVALID_STATUS_CODE("InvalidStatusCode"),

    INVALID_NUMERIC_FIELD("InvalidNumericField"),

    TRUNCATED_LINE("TruncatedLine");

    private final String value;

    ParseErrorKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
