package com.forenx.sentinel.ingestion;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

/**
 * Opens log sources for line reading. Gzip content is detected by its magic bytes, so rotated
 * {@code access.log.2.gz} files need no special naming. Lines are read from the decompressed
 * content.
 */
public final class LogFileReader {

    private static final int GZIP_MAGIC_1 = 0x1f;
    private static final int GZIP_MAGIC_2 = 0x8b;

    private LogFileReader() {
    }

    public static SourceLineReader open(Path path) throws IOException {
        return open(Files.newInputStream(path));
    }

    public static SourceLineReader open(InputStream raw) throws IOException {
        BufferedInputStream in = new BufferedInputStream(raw);
        in.mark(2);
        int b1 = in.read();
        int b2 = in.read();
        in.reset();
        InputStream content = b1 == GZIP_MAGIC_1 && b2 == GZIP_MAGIC_2 ? new GZIPInputStream(in) : in;
        return new SourceLineReader(content);
    }
}
