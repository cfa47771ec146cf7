package com.forenx.sentinel.normalization;

import com.forenx.sentinel.domain.LogRecord;
import com.forenx.sentinel.normalization.parsers.LogFormatParser;
import com.forenx.sentinel.normalization.parsers.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns raw log lines into normalized records.
 * Pure apart from metrics: no I/O, no clock, no randomness.
 */
@Service
public class LineParser {

    private static final Logger log = LoggerFactory.getLogger(LineParser.class);

    private final FormatDetector formatDetector;
    private final NormalizationMetrics metrics;

    public LineParser(FormatDetector formatDetector, NormalizationMetrics metrics) {
        this.formatDetector = formatDetector;
        this.metrics = metrics;
    }

    /**
     * Parse one line.
     *
     * @param line raw line without trailing newline
     * @param sourceFileId id of the source the line came from
     * @param lineOffset zero-based line number within the source
     * @return the normalized record
     * @throws ParseException if the line is malformed; never returns a partially defaulted record
     */
    public LogRecord parse(String line, String sourceFileId, long lineOffset) throws ParseException {
        String stripped = stripLineTerminator(line);
        try {
            LogFormatParser parser = formatDetector.detect(stripped);
            LogRecord record = parser.parse(stripped, sourceFileId, lineOffset);
            metrics.recordParsed(parser.getFormatName());
            return record;
        } catch (ParseException e) {
            metrics.recordFailed(e.getKind());
            log.debug("Rejected line {} of {}: {} ({})", lineOffset, sourceFileId, e.getKind().getValue(), e.getMessage());
            throw e;
        }
    }

    private static String stripLineTerminator(String line) {
        if (line == null) {
            return "";
        }
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) {
            end--;
        }
        return end == line.length() ? line : line.substring(0, end);
    }
}
