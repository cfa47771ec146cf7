package com.forenx.sentinel.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stable error kinds reported at the service boundary.
 */
public enum ErrorKind {

    PARSE_ERROR("parse_error", 400),

    ENRICHMENT_LOOKUP_FAILURE("enrichment_lookup_failure", 502),

    CLASSIFIER_CONFIG_ERROR("classifier_config_error", 400),

    STORAGE_WRITE_FAILURE("storage_write_failure", 503),

    CAPACITY_EXCEEDED("capacity_exceeded", 429),

    INVALID_QUERY("invalid_query", 400),

    INTERNAL("internal", 500);

    private final String value;
    private final int httpStatus;

    ErrorKind(String value, int httpStatus) {
        this.value = value;
        this.httpStatus = httpStatus;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
