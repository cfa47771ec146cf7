package com.forenx.sentinel.normalization.parsers;

import com.forenx.sentinel.domain.LogRecord;

import java.util.HashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for line formats described by a regular expression with named capture groups
 * (combined, common, extended and user-defined formats).
 */
public class PatternFormatParser extends AbstractLogFormatParser {

    private static final Pattern GROUP_NAME = Pattern.compile("\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

    private final Pattern pattern;
    private final FormatDefinition.Mode mode;
    private final Set<String> groups;

    public PatternFormatParser(String formatName, Pattern pattern, int priority, FormatDefinition.Mode mode) {
        super(formatName, priority);
        this.pattern = pattern;
        this.mode = mode;
        this.groups = extractGroupNames(pattern.pattern());
        if (!groups.contains("ip") || !groups.contains("timestamp") || !groups.contains("status")) {
            throw new IllegalArgumentException(
                "Format " + formatName + " must capture the groups ip, timestamp and status");
        }
        if (!groups.contains("request") && !groups.contains("endpoint")) {
            throw new IllegalArgumentException(
                "Format " + formatName + " must capture either a request or an endpoint group");
        }
    }

    @Override
    public boolean accepts(String line) {
        return matcher(line) != null;
    }

    @Override
    public LogRecord parse(String line, String sourceFileId, long lineOffset) throws ParseException {
        Matcher matcher = matcher(line);
        if (matcher == null) {
            throw new ParseException(ParseErrorKind.UNMATCHED_FORMAT,
                "Line does not match format " + getFormatName(), getFormatName(), line);
        }
        try {
            LogRecord.Builder builder = LogRecord.builder()
                .sourceFileId(sourceFileId)
                .lineOffset(lineOffset)
                .format(getFormatName())
                .clientIp(group(matcher, "ip"))
                .timestamp(TimestampParser.parse(group(matcher, "timestamp")))
                .statusCode(parseStatus(group(matcher, "status")))
                .bytesSent(parseBytes(group(matcher, "bytes")))
                .referrer(blankToNull(group(matcher, "referrer")))
                .userAgent(blankToNull(group(matcher, "useragent")))
                .responseTimeMs(parseRequestTimeSeconds(group(matcher, "requesttime")));

            if (groups.contains("request")) {
                applyRequestLine(builder, group(matcher, "request"));
            } else {
                builder.method(blankToNull(group(matcher, "method")));
                builder.protocolVersion(blankToNull(group(matcher, "protocol")));
                applyTarget(builder, group(matcher, "endpoint"));
            }

            builder.extra("remote_user", group(matcher, "user"));
            builder.extra("host", group(matcher, "host"));

            String ip = group(matcher, "ip");
            if (ip == null || ip.isEmpty() || "-".equals(ip)) {
                throw new ParseException(ParseErrorKind.UNMATCHED_FORMAT, "Missing client address");
            }
            return builder.build();
        } catch (ParseException e) {
            throw e.withContext(getFormatName(), line);
        }
    }

    private Matcher matcher(String line) {
        Matcher matcher = pattern.matcher(line);
        boolean matched = mode == FormatDefinition.Mode.STRICT ? matcher.matches() : matcher.lookingAt();
        return matched ? matcher : null;
    }

    private String group(Matcher matcher, String name) {
        return groups.contains(name) ? matcher.group(name) : null;
    }

    private static Set<String> extractGroupNames(String regex) {
        Set<String> names = new HashSet<>();
        Matcher matcher = GROUP_NAME.matcher(regex);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }
}
