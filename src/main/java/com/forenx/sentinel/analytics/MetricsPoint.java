package com.forenx.sentinel.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Read-only view of one metrics bucket as returned by a series query.
 */
public final class MetricsPoint {

    @JsonProperty("granularity")
    private final Granularity granularity;

    @JsonProperty("bucket_start")
    private final Instant bucketStart;

    @JsonProperty("request_count")
    private final long requestCount;

    @JsonProperty("error_count")
    private final long errorCount;

    @JsonProperty("bytes_total")
    private final long bytesTotal;

    @JsonProperty("unique_client_count")
    private final long uniqueClientCount;

    public MetricsPoint(Granularity granularity, Instant bucketStart, long requestCount, long errorCount,
                        long bytesTotal, long uniqueClientCount) {
        this.granularity = granularity;
        this.bucketStart = bucketStart;
        this.requestCount = requestCount;
        this.errorCount = errorCount;
        this.bytesTotal = bytesTotal;
        this.uniqueClientCount = uniqueClientCount;
    }

    static MetricsPoint empty(Granularity granularity, Instant bucketStart) {
        return new MetricsPoint(granularity, bucketStart, 0L, 0L, 0L, 0L);
    }

    public Granularity getGranularity() {
        return granularity;
    }

    public Instant getBucketStart() {
        return bucketStart;
    }

    public long getRequestCount() {
        return requestCount;
    }

    public long getErrorCount() {
        return errorCount;
    }

    public long getBytesTotal() {
        return bytesTotal;
    }

    public long getUniqueClientCount() {
        return uniqueClientCount;
    }

    @Override
    public String toString() {
        return granularity.getValue() + "@" + bucketStart + "{requests=" + requestCount + ", errors=" + errorCount
            + ", bytes=" + bytesTotal + ", clients~" + uniqueClientCount + "}";
    }
}
