package com.forenx.sentinel.ingestion;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Running SHA-256 over the content of one source.
 *
 * <p>Batch sources feed the exact bytes of each line, terminator included, so the digest of a
 * fully acknowledged source equals the SHA-256 of its (decompressed) content. Live sources only
 * have decoded lines; each is hashed as UTF-8 followed by a line feed.
 *
 * <p>Not thread-safe; fed by the single producer of a source.
 */
public final class IntegrityStamp {

    private final Hasher hasher = Hashing.sha256().newHasher();
    private long lines;
    private String digest;

    public void update(byte[] rawLine) {
        checkOpen();
        hasher.putBytes(rawLine);
        lines++;
    }

    public void update(String line) {
        checkOpen();
        hasher.putString(line, StandardCharsets.UTF_8);
        hasher.putByte((byte) '\n');
        lines++;
    }

    private void checkOpen() {
        if (digest != null) {
            throw new IllegalStateException("Integrity stamp already finished");
        }
    }

    /**
     * @return lowercase hex digest; further calls return the same value
     */
    public String finish() {
        if (digest == null) {
            digest = hasher.hash().toString();
        }
        return digest;
    }

    public long getLines() {
        return lines;
    }

    public static String of(byte[] content) {
        return Hashing.sha256().hashBytes(content).toString();
    }

    public static String of(Iterable<String> lines) {
        IntegrityStamp stamp = new IntegrityStamp();
        for (String line : lines) {
            stamp.update(line);
        }
        return stamp.finish();
    }
}
