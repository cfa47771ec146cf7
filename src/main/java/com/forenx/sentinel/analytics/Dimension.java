package com.forenx.sentinel.analytics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.forenx.sentinel.domain.LogRecord;

/**
 * Record attributes tracked for top-N queries.
 */
public enum Dimension {
    IP("ip"),
    ENDPOINT("endpoint"),
    USER_AGENT("user_agent"),
    STATUS_CODE("status_code");

    private final String value;

    Dimension(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    String extract(LogRecord record) {
        switch (this) {
            case IP:
                return record.getClientIp();
            case ENDPOINT:
                return record.getPath().isEmpty() ? "/" : record.getPath();
            case USER_AGENT:
                return record.getUserAgent() == null || record.getUserAgent().isEmpty() ? "-" : record.getUserAgent();
            case STATUS_CODE:
                return Integer.toString(record.getStatusCode());
            default:
                throw new IllegalStateException("Unhandled dimension " + this);
        }
    }

    @JsonCreator
    public static Dimension fromValue(String value) {
        for (Dimension d : values()) {
            if (d.value.equalsIgnoreCase(value) || d.name().equalsIgnoreCase(value)) {
                return d;
            }
        }
        throw new IllegalArgumentException("Unknown dimension: " + value);
    }
}
