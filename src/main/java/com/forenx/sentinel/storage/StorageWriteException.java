package com.forenx.sentinel.storage;

import com.forenx.sentinel.domain.ErrorKind;
import com.forenx.sentinel.domain.SentinelException;

/**
 * A record or alert could not be committed. Propagated to the ingestion caller, which may
 * resume the file from {@link #getFirstUnacknowledgedOffset()}.
 */
public class StorageWriteException extends SentinelException {

    private final String sourceFileId;
    private final long firstUnacknowledgedOffset;

    public StorageWriteException(String message, Throwable cause) {
        this(message, null, -1L, cause);
    }

    public StorageWriteException(String message, String sourceFileId, long firstUnacknowledgedOffset, Throwable cause) {
        super(message, cause);
        this.sourceFileId = sourceFileId;
        this.firstUnacknowledgedOffset = firstUnacknowledgedOffset;
    }

    /**
     * Returns a copy that names the file position the caller should retry from.
     */
    public StorageWriteException atOffset(String sourceFileId, long offset) {
        return new StorageWriteException(getMessage(), sourceFileId, offset, getCause());
    }

    public String getSourceFileId() {
        return sourceFileId;
    }

    /**
     * @return line offset of the first record that was not acknowledged, or -1 if unknown
     */
    public long getFirstUnacknowledgedOffset() {
        return firstUnacknowledgedOffset;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.STORAGE_WRITE_FAILURE;
    }
}
