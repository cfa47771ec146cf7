package com.forenx.sentinel.normalization;

import com.forenx.sentinel.normalization.parsers.LogFormatParser;
import com.forenx.sentinel.normalization.parsers.ParseErrorKind;
import com.forenx.sentinel.normalization.parsers.ParseException;
import com.forenx.sentinel.normalization.parsers.ParserRegistry;
import org.springframework.stereotype.Component;

/**
 * Detects which configured format a raw line belongs to.
 * Formats are tried in priority order and the first structural match wins.
 */
@Component
public class FormatDetector {

    private final ParserRegistry parserRegistry;

    public FormatDetector(ParserRegistry parserRegistry) {
        this.parserRegistry = parserRegistry;
    }

    /**
     * Detect the parser for a line.
     *
     * @throws ParseException with {@link ParseErrorKind#TRUNCATED_LINE} when the line looks cut off,
     *         or {@link ParseErrorKind#UNMATCHED_FORMAT} when no format applies
     */
    public LogFormatParser detect(String line) throws ParseException {
        if (line == null || line.isBlank()) {
            throw new ParseException(ParseErrorKind.UNMATCHED_FORMAT, "Empty line");
        }
        for (LogFormatParser parser : parserRegistry.getParsers()) {
            if (parser.accepts(line)) {
                return parser;
            }
        }

        if (isNginxErrorLog(line)) {
            throw new ParseException(ParseErrorKind.UNMATCHED_FORMAT,
                "nginx error log line carries no status code", "nginx-error", line);
        }
        if (looksTruncated(line)) {
            throw new ParseException(ParseErrorKind.TRUNCATED_LINE, "Line ends before all fields are closed", null, line);
        }
        throw new ParseException(ParseErrorKind.UNMATCHED_FORMAT, "No configured format matches", null, line);
    }

    static boolean isNginxErrorLog(String line) {
        return line.matches("^\\d{4}/\\d{2}/\\d{2} \\d{2}:\\d{2}:\\d{2} \\[\\w+\\] .*")
            || (line.contains(" client: ") && line.contains(" server: "));
    }

    /**
     * A line is considered truncated when it opens a structure it never closes:
     * a JSON object without closing brace, an odd number of quotes, or an unclosed bracket.
     */
    static boolean looksTruncated(String line) {
        String trimmed = line.trim();
        if (trimmed.startsWith("{")) {
            return !trimmed.endsWith("}");
        }
        int quotes = 0;
        boolean escaped = false;
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '"') {
                quotes++;
            }
        }
        if (quotes % 2 != 0) {
            return true;
        }
        int open = trimmed.indexOf('[');
        return open >= 0 && trimmed.indexOf(']', open) < 0;
    }
}
