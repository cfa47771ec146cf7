package com.forenx.sentinel.ingestion;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Splits a byte stream into lines at {@code \n} while keeping every line's exact bytes,
 * terminator included. Concatenating the raw bytes of all lines reproduces the stream.
 * The text of a line is its UTF-8 decoding without the trailing {@code \n} or {@code \r\n}.
 */
public final class SourceLineReader implements Closeable {

    private static final int BUFFER_SIZE = 8192;

    private final InputStream in;
    private final byte[] buffer = new byte[BUFFER_SIZE];
    private int position;
    private int limit;
    private boolean eof;

    public SourceLineReader(InputStream in) {
        this.in = in;
    }

    public static SourceLineReader of(String content) {
        return new SourceLineReader(new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * @return the next line, or null at the end of the stream
     */
    public Line next() throws IOException {
        ByteArrayOutputStream pending = null;
        while (true) {
            if (position == limit && !fill()) {
                if (eof) {
                    return pending == null || pending.size() == 0 ? null : new Line(pending.toByteArray());
                }
                continue;
            }
            int start = position;
            while (position < limit && buffer[position] != '\n') {
                position++;
            }
            if (position < limit) {
                position++;
                if (pending == null) {
                    return new Line(Arrays.copyOfRange(buffer, start, position));
                }
                pending.write(buffer, start, position - start);
                return new Line(pending.toByteArray());
            }
            if (pending == null) {
                pending = new ByteArrayOutputStream(Math.max(64, (limit - start) * 2));
            }
            pending.write(buffer, start, limit - start);
        }
    }

    private boolean fill() throws IOException {
        int read = in.read(buffer, 0, buffer.length);
        position = 0;
        limit = Math.max(read, 0);
        eof = read < 0;
        return read > 0;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }

    /**
     * One line of a source as read from the stream.
     */
    public static final class Line {
        private final byte[] raw;

        Line(byte[] raw) {
            this.raw = raw;
        }

        /**
         * The bytes exactly as they appeared, including any terminator.
         */
        public byte[] getRaw() {
            return raw;
        }

        public String getText() {
            int end = raw.length;
            if (end > 0 && raw[end - 1] == '\n') {
                end--;
            }
            if (end > 0 && raw[end - 1] == '\r') {
                end--;
            }
            return new String(raw, 0, end, StandardCharsets.UTF_8);
        }
    }
}
