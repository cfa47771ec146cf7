package com.forenx.sentinel.normalization.parsers;

import com.forenx.sentinel.domain.LogRecord;

/**
 * Parses one log line format into the normalized record schema.
 * Implementations must be pure: the same line and position always yield an equal record.
 */
public interface LogFormatParser {

    /**
     * Whether the line structurally matches this format. A structural match commits the
     * line to this format: field-level failures in {@link #parse} are then final.
     *
     * @param line the raw line, without trailing newline
     * @return true when the whole line (strict) or its prefix (loose) matches
     */
    boolean accepts(String line);

    /**
     * Parses a line that this parser {@link #accepts(String) accepts}.
     *
     * @param line the raw line
     * @param sourceFileId the id of the file or stream the line came from
     * @param lineOffset zero-based position of the line within its source
     * @return the parsed record
     * @throws ParseException if a mandatory field is missing or invalid
     */
    LogRecord parse(String line, String sourceFileId, long lineOffset) throws ParseException;

    /**
     * @return format identifier (e.g. "json", "combined")
     */
    String getFormatName();

    /**
     * Lower values are tried first.
     */
    int getPriority();
}
