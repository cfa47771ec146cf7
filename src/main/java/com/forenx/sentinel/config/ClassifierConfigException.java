package com.forenx.sentinel.config;

import com.forenx.sentinel.domain.ErrorKind;
import com.forenx.sentinel.domain.SentinelException;

/**
 * Thrown when a rule, format or threshold definition is invalid. Raised at load time,
 * before any line is processed with the offending definition.
 */
public class ClassifierConfigException extends SentinelException {

    private final String definition;

    public ClassifierConfigException(String message) {
        super(message);
        this.definition = null;
    }

    public ClassifierConfigException(String message, String definition) {
        super(message);
        this.definition = definition;
    }

    public ClassifierConfigException(String message, String definition, Throwable cause) {
        super(message, cause);
        this.definition = definition;
    }

    /**
     * @return the id or name of the offending definition, if known
     */
    public String getDefinition() {
        return definition;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.CLASSIFIER_CONFIG_ERROR;
    }
}
