package com.forenx.sentinel.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One ranked value of a top-N query. {@code count} is an upper bound; the true count lies in
 * {@code [count - error, count]}.
 */
public final class TopEntry {

    @JsonProperty("value")
    private final String value;

    @JsonProperty("count")
    private final long count;

    @JsonProperty("error")
    private final long error;

    public TopEntry(String value, long count, long error) {
        this.value = value;
        this.count = count;
        this.error = error;
    }

    public String getValue() {
        return value;
    }

    public long getCount() {
        return count;
    }

    public long getError() {
        return error;
    }

    @Override
    public String toString() {
        return value + "=" + count;
    }
}
