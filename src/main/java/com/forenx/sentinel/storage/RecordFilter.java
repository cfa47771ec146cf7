package com.forenx.sentinel.storage;

import com.forenx.sentinel.domain.LogRecord;

import java.time.Instant;
import java.util.Locale;

/**
 * Range and field filter for record queries. Null fields do not filter.
 * The range is half-open, {@code [from, to)}.
 */
public final class RecordFilter {

    private final Instant from;
    private final Instant to;
    private final String clientIp;
    private final String method;
    private final Integer statusCode;
    private final String pathContains;

    private RecordFilter(Builder b) {
        this.from = b.from;
        this.to = b.to;
        this.clientIp = b.clientIp;
        this.method = b.method;
        this.statusCode = b.statusCode;
        this.pathContains = b.pathContains;
    }

    public static Builder builder(Instant from, Instant to) {
        return new Builder(from, to);
    }

    public boolean matches(LogRecord record) {
        Instant ts = record.getTimestamp();
        if (ts.isBefore(from) || !ts.isBefore(to)) {
            return false;
        }
        if (clientIp != null && !clientIp.equals(record.getClientIp())) {
            return false;
        }
        if (method != null && !method.equalsIgnoreCase(record.getMethod())) {
            return false;
        }
        if (statusCode != null && statusCode != record.getStatusCode()) {
            return false;
        }
        return pathContains == null
            || record.getPath().toLowerCase(Locale.ROOT).contains(pathContains.toLowerCase(Locale.ROOT));
    }

    public Instant getFrom() {
        return from;
    }

    public Instant getTo() {
        return to;
    }

    public static final class Builder {
        private final Instant from;
        private final Instant to;
        private String clientIp;
        private String method;
        private Integer statusCode;
        private String pathContains;

        private Builder(Instant from, Instant to) {
            this.from = from;
            this.to = to;
        }

        public Builder clientIp(String clientIp) {
            this.clientIp = clientIp;
            return this;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder statusCode(Integer statusCode) {
            this.statusCode = statusCode;
            return this;
        }

        public Builder pathContains(String pathContains) {
            this.pathContains = pathContains;
            return this;
        }

        public RecordFilter build() {
            return new RecordFilter(this);
        }
    }
}
