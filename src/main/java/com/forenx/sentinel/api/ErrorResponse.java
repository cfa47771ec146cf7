package com.forenx.sentinel.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.forenx.sentinel.domain.ErrorKind;

import java.time.Instant;
import java.util.Map;

/**
 * JSON body of every error returned by the REST boundary.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class ErrorResponse {

    @JsonProperty("kind")
    private final ErrorKind kind;

    @JsonProperty("message")
    private final String message;

    @JsonProperty("timestamp")
    private final Instant timestamp;

    @JsonProperty("details")
    private final Map<String, Object> details;

    public ErrorResponse(ErrorKind kind, String message, Instant timestamp, Map<String, Object> details) {
        this.kind = kind;
        this.message = message;
        this.timestamp = timestamp;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static ErrorResponse of(ErrorKind kind, String message) {
        return new ErrorResponse(kind, message, Instant.now(), Map.of());
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
