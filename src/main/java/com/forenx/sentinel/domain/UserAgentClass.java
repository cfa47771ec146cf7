package com.forenx.sentinel.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse classification of a request's User-Agent header.
 */
public enum UserAgentClass {

    BROWSER("browser"),

    BOT("bot"),

    UNKNOWN("unknown");

    private final String value;

    UserAgentClass(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
