package com.forenx.sentinel.detection.signature;

import java.util.Locale;

/**
 * Parts of a request a signature rule can be evaluated against.
 */
public enum RequestTarget {
    PATH("path"),
    QUERY("query"),
    REFERRER("referrer"),
    USER_AGENT("user_agent"),
    /** Textual optional fields such as request body or header dumps. */
    EXTRAS("extras");

    private final String name;

    RequestTarget(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static RequestTarget fromName(String name) {
        String n = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        for (RequestTarget target : values()) {
            if (target.name.equals(n)) {
                return target;
            }
        }
        throw new IllegalArgumentException("Unknown rule target: " + name);
    }
}
