package com.forenx.sentinel.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate view of a time range: volume, errors, status classes and methods.
 */
public final class MetricsSummary {

    @JsonProperty("from")
    private final Instant from;

    @JsonProperty("to")
    private final Instant to;

    @JsonProperty("total_requests")
    private final long totalRequests;

    @JsonProperty("unique_ips")
    private final long uniqueIps;

    @JsonProperty("bytes_total")
    private final long bytesTotal;

    @JsonProperty("error_count")
    private final long errorCount;

    @JsonProperty("error_rate")
    private final double errorRate;

    @JsonProperty("status_classes")
    private final Map<String, Long> statusClasses;

    @JsonProperty("methods")
    private final Map<String, Long> methods;

    public MetricsSummary(Instant from, Instant to, long totalRequests, long uniqueIps, long bytesTotal,
                          long errorCount, Map<String, Long> statusClasses, Map<String, Long> methods) {
        this.from = from;
        this.to = to;
        this.totalRequests = totalRequests;
        this.uniqueIps = uniqueIps;
        this.bytesTotal = bytesTotal;
        this.errorCount = errorCount;
        this.errorRate = totalRequests == 0 ? 0.0 : (double) errorCount / totalRequests;
        this.statusClasses = Map.copyOf(statusClasses);
        this.methods = Map.copyOf(methods);
    }

    public Instant getFrom() {
        return from;
    }

    public Instant getTo() {
        return to;
    }

    public long getTotalRequests() {
        return totalRequests;
    }

    public long getUniqueIps() {
        return uniqueIps;
    }

    public long getBytesTotal() {
        return bytesTotal;
    }

    public long getErrorCount() {
        return errorCount;
    }

    public double getErrorRate() {
        return errorRate;
    }

    public Map<String, Long> getStatusClasses() {
        return statusClasses;
    }

    public Map<String, Long> getMethods() {
        return methods;
    }
}
