package com.forenx.sentinel.live;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.forenx.sentinel.domain.Alert;
import com.forenx.sentinel.domain.LogRecord;

import java.time.Instant;

/**
 * Event pushed to live subscribers.
 */
public final class LiveEvent {

    public enum Type {
        RECORD_COMMITTED("record_committed"),
        ALERT_RAISED("alert_raised");

        private final String value;

        Type(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }

    @JsonProperty("type")
    private final Type type;

    @JsonProperty("published_at")
    private final Instant publishedAt;

    @JsonProperty("payload")
    private final Object payload;

    private LiveEvent(Type type, Instant publishedAt, Object payload) {
        this.type = type;
        this.publishedAt = publishedAt;
        this.payload = payload;
    }

    public static LiveEvent recordCommitted(LogRecord record) {
        return new LiveEvent(Type.RECORD_COMMITTED, Instant.now(), record);
    }

    public static LiveEvent alertRaised(Alert alert) {
        return new LiveEvent(Type.ALERT_RAISED, Instant.now(), alert);
    }

    public Type getType() {
        return type;
    }

    public Instant getPublishedAt() {
        return publishedAt;
    }

    public Object getPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return "LiveEvent{" + type.getValue() + " " + payload + "}";
    }
}
