package com.forenx.sentinel.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One parsed request/response event taken from a web-server access log line.
 *
 * The core schema is fixed; fields that only some formats carry (virtual host,
 * remote user, request body, header dumps) live in the {@link #getExtras() extras} map.
 * Instances are immutable. Enrichment is attached exactly once through
 * {@link #withEnrichment(Enrichment)}, which returns a copy.
 */
public final class LogRecord {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("timestamp")
    private final Instant timestamp;

    @JsonProperty("client_ip")
    private final String clientIp;

    @JsonProperty("method")
    private final String method;

    @JsonProperty("path")
    private final String path;

    @JsonProperty("query")
    private final String query;

    @JsonProperty("protocol_version")
    private final String protocolVersion;

    @JsonProperty("status_code")
    private final int statusCode;

    @JsonProperty("bytes_sent")
    private final long bytesSent;

    @JsonProperty("referrer")
    private final String referrer;

    @JsonProperty("user_agent")
    private final String userAgent;

    @JsonProperty("response_time_ms")
    private final Long responseTimeMs;

    @JsonProperty("source_file_id")
    private final String sourceFileId;

    @JsonProperty("line_offset")
    private final long lineOffset;

    @JsonProperty("format")
    private final String format;

    @JsonProperty("extras")
    private final Map<String, String> extras;

    @JsonProperty("enrichment")
    private final Enrichment enrichment;

    private LogRecord(Builder builder, Enrichment enrichment) {
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp");
        this.clientIp = Objects.requireNonNull(builder.clientIp, "clientIp");
        this.method = builder.method;
        this.path = builder.path != null ? builder.path : "";
        this.query = builder.query != null ? builder.query : "";
        this.protocolVersion = builder.protocolVersion;
        this.statusCode = builder.statusCode;
        this.bytesSent = builder.bytesSent;
        this.referrer = builder.referrer;
        this.userAgent = builder.userAgent;
        this.responseTimeMs = builder.responseTimeMs;
        this.sourceFileId = builder.sourceFileId;
        this.lineOffset = builder.lineOffset;
        this.format = builder.format;
        this.extras = Collections.unmodifiableMap(new LinkedHashMap<>(builder.extras));
        this.id = sourceFileId + ":" + lineOffset;
        this.enrichment = enrichment;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a copy carrying the given enrichment.
     *
     * @throws IllegalStateException if this record is already enriched
     */
    public LogRecord withEnrichment(Enrichment enrichment) {
        if (this.enrichment != null) {
            throw new IllegalStateException("Record " + id + " is already enriched");
        }
        return new LogRecord(toBuilder(), Objects.requireNonNull(enrichment, "enrichment"));
    }

    private Builder toBuilder() {
        Builder builder = new Builder()
            .timestamp(timestamp)
            .clientIp(clientIp)
            .method(method)
            .path(path)
            .query(query)
            .protocolVersion(protocolVersion)
            .statusCode(statusCode)
            .bytesSent(bytesSent)
            .referrer(referrer)
            .userAgent(userAgent)
            .responseTimeMs(responseTimeMs)
            .sourceFileId(sourceFileId)
            .lineOffset(lineOffset)
            .format(format);
        builder.extras.putAll(extras);
        return builder;
    }

    public String getId() {
        return id;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getClientIp() {
        return clientIp;
    }

    public String getMethod() {
        return method;
    }

    public String getPath() {
        return path;
    }

    public String getQuery() {
        return query;
    }

    public String getProtocolVersion() {
        return protocolVersion;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public long getBytesSent() {
        return bytesSent;
    }

    public String getReferrer() {
        return referrer;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public Long getResponseTimeMs() {
        return responseTimeMs;
    }

    public String getSourceFileId() {
        return sourceFileId;
    }

    public long getLineOffset() {
        return lineOffset;
    }

    public String getFormat() {
        return format;
    }

    public Map<String, String> getExtras() {
        return extras;
    }

    public Enrichment getEnrichment() {
        return enrichment;
    }

    public boolean isError() {
        return statusCode >= 400;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LogRecord)) {
            return false;
        }
        LogRecord that = (LogRecord) o;
        return statusCode == that.statusCode
            && bytesSent == that.bytesSent
            && lineOffset == that.lineOffset
            && timestamp.equals(that.timestamp)
            && clientIp.equals(that.clientIp)
            && Objects.equals(method, that.method)
            && path.equals(that.path)
            && query.equals(that.query)
            && Objects.equals(protocolVersion, that.protocolVersion)
            && Objects.equals(referrer, that.referrer)
            && Objects.equals(userAgent, that.userAgent)
            && Objects.equals(responseTimeMs, that.responseTimeMs)
            && Objects.equals(sourceFileId, that.sourceFileId)
            && Objects.equals(format, that.format)
            && extras.equals(that.extras)
            && Objects.equals(enrichment, that.enrichment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, timestamp, clientIp, method, path, query, statusCode, bytesSent);
    }

    @Override
    public String toString() {
        return "LogRecord{" + id + " " + clientIp + " " + method + " " + path + " " + statusCode + "}";
    }

    /**
     * Builder used by the parsers. Mandatory fields are checked on {@link #build()}.
     */
    public static final class Builder {
        private Instant timestamp;
        private String clientIp;
        private String method;
        private String path;
        private String query;
        private String protocolVersion;
        private int statusCode;
        private long bytesSent;
        private String referrer;
        private String userAgent;
        private Long responseTimeMs;
        private String sourceFileId;
        private long lineOffset;
        private String format;
        private final Map<String, String> extras = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder clientIp(String clientIp) {
            this.clientIp = clientIp;
            return this;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder protocolVersion(String protocolVersion) {
            this.protocolVersion = protocolVersion;
            return this;
        }

        public Builder statusCode(int statusCode) {
            this.statusCode = statusCode;
            return this;
        }

        public Builder bytesSent(long bytesSent) {
            this.bytesSent = bytesSent;
            return this;
        }

        public Builder referrer(String referrer) {
            this.referrer = referrer;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder responseTimeMs(Long responseTimeMs) {
            this.responseTimeMs = responseTimeMs;
            return this;
        }

        public Builder sourceFileId(String sourceFileId) {
            this.sourceFileId = sourceFileId;
            return this;
        }

        public Builder lineOffset(long lineOffset) {
            this.lineOffset = lineOffset;
            return this;
        }

        public Builder format(String format) {
            this.format = format;
            return this;
        }

        public Builder extra(String key, String value) {
            if (value != null && !value.isEmpty() && !"-".equals(value)) {
                this.extras.put(key, value);
            }
            return this;
        }

        public LogRecord build() {
            if (statusCode < 100 || statusCode > 599) {
                throw new IllegalArgumentException("status code out of range: " + statusCode);
            }
            if (bytesSent < 0) {
                throw new IllegalArgumentException("bytes sent must be >= 0: " + bytesSent);
            }
            if (responseTimeMs != null && responseTimeMs < 0) {
                throw new IllegalArgumentException("response time must be >= 0: " + responseTimeMs);
            }
            return new LogRecord(this, null);
        }
    }
}
