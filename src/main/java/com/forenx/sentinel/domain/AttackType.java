package com.forenx.sentinel.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Attack categories an alert can carry.
 */
public enum AttackType {

    SQL_INJECTION("SQLInjection", Source.SIGNATURE),

    XSS("XSS", Source.SIGNATURE),

    PATH_TRAVERSAL("PathTraversal", Source.SIGNATURE),

    BRUTE_FORCE("BruteForce", Source.BEHAVIOR),

    DOS("DoS", Source.BEHAVIOR),

    DATA_EXFILTRATION("DataExfiltration", Source.BEHAVIOR);

    /**
     * Which classifier produces this attack type.
     */
    public enum Source {
        SIGNATURE,
        BEHAVIOR
    }

    private final String value;
    private final Source source;

    AttackType(String value, Source source) {
        this.value = value;
        this.source = source;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Source getSource() {
        return source;
    }

    /**
     * Parse either the wire value ("SQLInjection") or the constant name ("SQL_INJECTION").
     */
    @JsonCreator
    public static AttackType fromValue(String value) {
        for (AttackType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown AttackType value: " + value);
    }
}
