package com.forenx.sentinel.normalization;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forenx.sentinel.domain.LogRecord;
import com.forenx.sentinel.normalization.parsers.ParseErrorKind;
import com.forenx.sentinel.normalization.parsers.ParseException;
import com.forenx.sentinel.normalization.parsers.ParserRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LineParser Tests")
class LineParserTest {

    private static final String COMBINED =
        "203.0.113.7 - - [10/Oct/2023:13:55:36 +0000] \"GET /index.html?x=1 HTTP/1.1\" 200 2326 "
            + "\"http://example.com/start\" \"Mozilla/5.0 (X11; Linux x86_64)\"";

    private NormalizationMetrics metrics;
    private LineParser parser;

    @BeforeEach
    void setUp() {
        metrics = new NormalizationMetrics(new SimpleMeterRegistry());
        parser = new LineParser(new FormatDetector(new ParserRegistry(new ObjectMapper())), metrics);
    }

    @Test
    @DisplayName("Should parse a combined format line into every record field")
    void shouldParseCombinedLine() throws Exception {
        LogRecord record = parser.parse(COMBINED, "access.log", 0);

        assertThat(record.getFormat()).isEqualTo("combined");
        assertThat(record.getId()).isEqualTo("access.log:0");
        assertThat(record.getClientIp()).isEqualTo("203.0.113.7");
        assertThat(record.getTimestamp()).isEqualTo(Instant.parse("2023-10-10T13:55:36Z"));
        assertThat(record.getMethod()).isEqualTo("GET");
        assertThat(record.getPath()).isEqualTo("/index.html");
        assertThat(record.getQuery()).isEqualTo("x=1");
        assertThat(record.getProtocolVersion()).isEqualTo("HTTP/1.1");
        assertThat(record.getStatusCode()).isEqualTo(200);
        assertThat(record.getBytesSent()).isEqualTo(2326L);
        assertThat(record.getReferrer()).isEqualTo("http://example.com/start");
        assertThat(record.getUserAgent()).startsWith("Mozilla/5.0");
        assertThat(metrics.getParsedCount("combined")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should parse common format and convert the offset to UTC")
    void shouldParseCommonLine() throws Exception {
        LogRecord record = parser.parse(
            "10.0.0.1 - frank [10/Oct/2000:13:55:36 -0700] \"GET /apache_pb.gif HTTP/1.0\" 200 -", "a.log", 3);

        assertThat(record.getFormat()).isEqualTo("common");
        assertThat(record.getTimestamp()).isEqualTo(Instant.parse("2000-10-10T20:55:36Z"));
        assertThat(record.getBytesSent()).isZero();
        assertThat(record.getExtras()).containsEntry("remote_user", "frank");
        assertThat(record.getUserAgent()).isNull();
        assertThat(record.getLineOffset()).isEqualTo(3L);
    }

    @Test
    @DisplayName("Should parse JSON structured lines")
    void shouldParseJsonLine() throws Exception {
        String line = "{\"time\":\"2023-10-10T13:55:36Z\",\"remote_addr\":\"198.51.100.2\","
            + "\"request\":\"POST /login HTTP/1.1\",\"status\":401,\"body_bytes_sent\":\"0\","
            + "\"request_time\":\"0.120\",\"upstream\":\"app-1\"}";

        LogRecord record = parser.parse(line, "json.log", 0);

        assertThat(record.getFormat()).isEqualTo("json");
        assertThat(record.getMethod()).isEqualTo("POST");
        assertThat(record.getPath()).isEqualTo("/login");
        assertThat(record.getStatusCode()).isEqualTo(401);
        assertThat(record.getResponseTimeMs()).isEqualTo(120L);
        assertThat(record.getExtras()).containsEntry("upstream", "app-1");
    }

    @Test
    @DisplayName("Should read a fractional epoch-seconds JSON timestamp")
    void shouldParseFractionalEpochTimestamp() throws Exception {
        String line = "{\"ts\":1700000000.123,\"remote_addr\":\"203.0.113.5\","
            + "\"method\":\"GET\",\"uri\":\"/health\",\"status\":200,\"size\":512}";

        LogRecord record = parser.parse(line, "caddy.log", 0);

        assertThat(record.getTimestamp()).isEqualTo(Instant.ofEpochMilli(1_700_000_000_123L));
        assertThat(record.getStatusCode()).isEqualTo(200);
        assertThat(record.getBytesSent()).isEqualTo(512L);
    }

    @Test
    @DisplayName("Should be idempotent: the same line always yields an equal record")
    void shouldBeIdempotent() throws Exception {
        LogRecord first = parser.parse(COMBINED, "access.log", 7);
        LogRecord second = parser.parse(COMBINED, "access.log", 7);

        assertThat(second).isEqualTo(first);
        assertThat(second.getId()).isEqualTo(first.getId());
    }

    @Test
    @DisplayName("Should ignore trailing CR/LF")
    void shouldStripLineTerminators() throws Exception {
        assertThat(parser.parse(COMBINED + "\r\n", "access.log", 0))
            .isEqualTo(parser.parse(COMBINED, "access.log", 0));
    }

    @Test
    @DisplayName("Should decode the path and keep the query raw")
    void shouldDecodePath() throws Exception {
        LogRecord record = parser.parse(
            "1.2.3.4 - - [10/Oct/2023:13:55:36 +0000] \"GET /a%20b/..%2Fetc?q=%27x HTTP/1.1\" 404 0 \"-\" \"-\"",
            "a.log", 0);

        assertThat(record.getPath()).isEqualTo("/a b/../etc");
        assertThat(record.getQuery()).isEqualTo("q=%27x");
        assertThat(record.getReferrer()).isNull();
    }

    @Test
    @DisplayName("Should reject out-of-range status codes")
    void shouldRejectInvalidStatus() {
        assertThatThrownBy(() -> parser.parse(
            "1.2.3.4 - - [10/Oct/2023:13:55:36 +0000] \"GET / HTTP/1.1\" 999 12 \"-\" \"-\"", "a.log", 0))
            .isInstanceOf(ParseException.class)
            .extracting(e -> ((ParseException) e).getKind())
            .isEqualTo(ParseErrorKind.INVALID_STATUS_CODE);
        assertThat(metrics.getFailedCount(ParseErrorKind.INVALID_STATUS_CODE)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject non-numeric byte counts")
    void shouldRejectInvalidBytes() {
        assertThatThrownBy(() -> parser.parse(
            "1.2.3.4 - - [10/Oct/2023:13:55:36 +0000] \"GET / HTTP/1.1\" 200 lots \"-\" \"-\"", "a.log", 0))
            .isInstanceOf(ParseException.class)
            .extracting(e -> ((ParseException) e).getKind())
            .isEqualTo(ParseErrorKind.INVALID_NUMERIC_FIELD);
    }

    @Test
    @DisplayName("Should reject unparseable timestamps instead of substituting the current time")
    void shouldRejectInvalidTimestamp() {
        assertThatThrownBy(() -> parser.parse(
            "1.2.3.4 - - [yesterday] \"GET / HTTP/1.1\" 200 12 \"-\" \"-\"", "a.log", 0))
            .isInstanceOf(ParseException.class)
            .extracting(e -> ((ParseException) e).getKind())
            .isEqualTo(ParseErrorKind.INVALID_TIMESTAMP);
    }

    @Test
    @DisplayName("Should classify lines cut off mid-field as truncated")
    void shouldDetectTruncatedLine() {
        assertThatThrownBy(() -> parser.parse(
            "1.2.3.4 - - [10/Oct/2023:13:55:36 +0000] \"GET /index.html HTTP/1.1", "a.log", 0))
            .isInstanceOf(ParseException.class)
            .extracting(e -> ((ParseException) e).getKind())
            .isEqualTo(ParseErrorKind.TRUNCATED_LINE);
    }

    @Test
    @DisplayName("Should reject nginx error log lines as unmatched")
    void shouldRejectNginxErrorLine() {
        assertThatThrownBy(() -> parser.parse(
            "2023/10/10 13:55:36 [error] 123#0: *1 open() failed, client: 1.2.3.4, server: example.com",
            "error.log", 0))
            .isInstanceOf(ParseException.class)
            .extracting(e -> ((ParseException) e).getKind())
            .isEqualTo(ParseErrorKind.UNMATCHED_FORMAT);
    }

    @Test
    @DisplayName("Should reject empty lines")
    void shouldRejectEmptyLine() {
        assertThatThrownBy(() -> parser.parse("", "a.log", 0))
            .isInstanceOf(ParseException.class)
            .extracting(e -> ((ParseException) e).getKind())
            .isEqualTo(ParseErrorKind.UNMATCHED_FORMAT);
    }
}
