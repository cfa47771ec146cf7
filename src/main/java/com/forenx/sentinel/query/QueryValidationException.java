package com.forenx.sentinel.query;

import com.forenx.sentinel.domain.ErrorKind;
import com.forenx.sentinel.domain.SentinelException;

/**
 * Exception thrown when query parameters are missing, malformed or out of bounds.
 */
public class QueryValidationException extends SentinelException {

    private final String parameter;

    public QueryValidationException(String parameter, String message) {
        super(message);
        this.parameter = parameter;
    }

    public QueryValidationException(String parameter, String message, Throwable cause) {
        super(message, cause);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.INVALID_QUERY;
    }
}
