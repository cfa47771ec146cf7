package com.forenx.sentinel.domain;

/**
 * Base class for all failures that cross a component boundary.
 * Each subclass maps to exactly one {@link ErrorKind}.
 */
public abstract class SentinelException extends RuntimeException {

    protected SentinelException(String message) {
        super(message);
    }

    protected SentinelException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind getErrorKind();
}
