package com.forenx.sentinel.normalization.parsers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forenx.sentinel.domain.LogRecord;

import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Parser for JSON-structured access logs (nginx {@code escape=json} templates,
 * Caddy, Traefik and similar). Common field names are recognised; every other
 * scalar field is kept in the record extras.
 */
public class JsonFormatParser extends AbstractLogFormatParser {

    private static final String[] TIMESTAMP_FIELDS = {"timestamp", "@timestamp", "time", "time_iso8601", "time_local", "datetime", "ts"};
    private static final String[] IP_FIELDS = {"client_ip", "remote_addr", "clientip", "ip", "client"};
    private static final String[] METHOD_FIELDS = {"method", "request_method"};
    private static final String[] PATH_FIELDS = {"path", "request_uri", "uri", "endpoint", "url"};
    private static final String[] QUERY_FIELDS = {"query", "query_string", "args"};
    private static final String[] REQUEST_FIELDS = {"request"};
    private static final String[] PROTOCOL_FIELDS = {"protocol", "server_protocol", "protocol_version"};
    private static final String[] STATUS_FIELDS = {"status", "status_code"};
    private static final String[] BYTES_FIELDS = {"bytes_sent", "body_bytes_sent", "bytes", "size"};
    private static final String[] REFERRER_FIELDS = {"referrer", "http_referer", "referer"};
    private static final String[] USER_AGENT_FIELDS = {"user_agent", "http_user_agent", "agent"};

    private static final Set<String> KNOWN_FIELDS = Set.of(
        "timestamp", "@timestamp", "time", "time_iso8601", "time_local", "datetime", "ts",
        "client_ip", "remote_addr", "clientip", "ip", "client",
        "method", "request_method", "path", "request_uri", "uri", "endpoint", "url",
        "query", "query_string", "args", "request", "protocol", "server_protocol", "protocol_version",
        "status", "status_code", "bytes_sent", "body_bytes_sent", "bytes", "size",
        "referrer", "http_referer", "referer", "user_agent", "http_user_agent", "agent",
        "response_time_ms", "request_time");

    private final ObjectMapper objectMapper;

    public JsonFormatParser(String formatName, int priority, ObjectMapper objectMapper) {
        super(formatName, priority);
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean accepts(String line) {
        String trimmed = line.trim();
        return trimmed.startsWith("{") && trimmed.endsWith("}");
    }

    @Override
    public LogRecord parse(String line, String sourceFileId, long lineOffset) throws ParseException {
        JsonNode json;
        try {
            json = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new ParseException(ParseErrorKind.UNMATCHED_FORMAT, "Malformed JSON log line", e)
                .withContext(getFormatName(), line);
        }
        if (json == null || !json.isObject()) {
            throw new ParseException(ParseErrorKind.UNMATCHED_FORMAT, "JSON log line is not an object",
                getFormatName(), line);
        }

        try {
            String ip = text(json, IP_FIELDS);
            if (ip == null) {
                throw new ParseException(ParseErrorKind.UNMATCHED_FORMAT, "Missing client address");
            }

            LogRecord.Builder builder = LogRecord.builder()
                .sourceFileId(sourceFileId)
                .lineOffset(lineOffset)
                .format(getFormatName())
                .clientIp(ip)
                .timestamp(TimestampParser.parse(text(json, TIMESTAMP_FIELDS)))
                .statusCode(parseStatus(text(json, STATUS_FIELDS)))
                .bytesSent(parseBytes(text(json, BYTES_FIELDS)))
                .referrer(blankToNull(text(json, REFERRER_FIELDS)))
                .userAgent(blankToNull(text(json, USER_AGENT_FIELDS)))
                .responseTimeMs(responseTime(json));

            String path = text(json, PATH_FIELDS);
            String request = text(json, REQUEST_FIELDS);
            if (path != null) {
                builder.method(blankToNull(text(json, METHOD_FIELDS)));
                builder.protocolVersion(blankToNull(text(json, PROTOCOL_FIELDS)));
                applyTarget(builder, path);
                String query = text(json, QUERY_FIELDS);
                if (query != null && path.indexOf('?') < 0) {
                    builder.query(query);
                }
            } else {
                applyRequestLine(builder, request);
            }

            Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (KNOWN_FIELDS.contains(field.getKey())) {
                    continue;
                }
                JsonNode value = field.getValue();
                if (value.isValueNode()) {
                    builder.extra(field.getKey(), value.asText());
                } else if (!value.isNull()) {
                    builder.extra(field.getKey(), value.toString());
                }
            }
            return builder.build();
        } catch (ParseException e) {
            throw e.withContext(getFormatName(), line);
        }
    }

    private Long responseTime(JsonNode json) throws ParseException {
        String millis = text(json, new String[]{"response_time_ms"});
        if (millis != null) {
            try {
                long value = Math.round(Double.parseDouble(millis));
                if (value < 0) {
                    throw new ParseException(ParseErrorKind.INVALID_NUMERIC_FIELD, "Negative response time: " + millis);
                }
                return value;
            } catch (NumberFormatException e) {
                throw new ParseException(ParseErrorKind.INVALID_NUMERIC_FIELD, "Non-numeric response time: " + millis, e);
            }
        }
        return parseRequestTimeSeconds(text(json, new String[]{"request_time"}));
    }

    private static String text(JsonNode json, String[] candidates) {
        for (String field : candidates) {
            JsonNode value = json.get(field);
            if (value == null || value.isNull()) {
                continue;
            }
            // asText() renders doubles in exponent notation
            return value.isNumber() ? value.decimalValue().toPlainString() : value.asText();
        }
        return null;
    }
}
