package com.forenx.sentinel.storage;

import com.forenx.sentinel.domain.LogRecord;

/**
 * Committed log records. A record counts as committed once {@link #append} returns.
 */
public interface RecordStore {

    /**
     * @throws StorageWriteException if the record could not be persisted
     */
    void append(LogRecord record) throws StorageWriteException;

    /**
     * Records matching the filter, oldest first.
     */
    Page<LogRecord> find(RecordFilter filter, int offset, int limit);

    long count();
}
