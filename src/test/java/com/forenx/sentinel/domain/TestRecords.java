package com.forenx.sentinel.domain;

import java.time.Instant;

/**
 * Record builders shared by the tests.
 */
public final class TestRecords {

    public static final Instant T0 = Instant.parse("2024-03-04T09:00:00Z");

    private TestRecords() {
    }

    public static LogRecord.Builder request(String ip, String path, int status) {
        return LogRecord.builder()
            .timestamp(T0)
            .clientIp(ip)
            .method("GET")
            .path(path)
            .protocolVersion("HTTP/1.1")
            .statusCode(status)
            .bytesSent(512)
            .userAgent("Mozilla/5.0")
            .sourceFileId("test.log")
            .format("combined");
    }

    public static LogRecord at(Instant timestamp, String ip, String path, int status, long offset) {
        return request(ip, path, status).timestamp(timestamp).lineOffset(offset).build();
    }

    public static LogRecord enriched(LogRecord record) {
        return record.withEnrichment(Enrichment.UNKNOWN);
    }
}
