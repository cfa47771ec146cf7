package com.forenx.sentinel.storage;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One page of a range query.
 */
public final class Page<T> {

    @JsonProperty("items")
    private final List<T> items;

    @JsonProperty("offset")
    private final int offset;

    @JsonProperty("limit")
    private final int limit;

    @JsonProperty("total")
    private final long total;

    public Page(List<T> items, int offset, int limit, long total) {
        this.items = List.copyOf(items);
        this.offset = offset;
        this.limit = limit;
        this.total = total;
    }

    public List<T> getItems() {
        return items;
    }

    public int getOffset() {
        return offset;
    }

    public int getLimit() {
        return limit;
    }

    public long getTotal() {
        return total;
    }

    @JsonProperty("has_more")
    public boolean hasMore() {
        return (long) offset + items.size() < total;
    }
}
