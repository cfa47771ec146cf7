package com.forenx.sentinel.ingestion;

import com.forenx.sentinel.domain.ErrorKind;
import com.forenx.sentinel.domain.SentinelException;

/**
 * The pipeline cannot take more input, either because it is shutting down or because a
 * non-blocking submission found the queue full.
 */
public class CapacityExceededException extends SentinelException {

    public CapacityExceededException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.CAPACITY_EXCEEDED;
    }
}
