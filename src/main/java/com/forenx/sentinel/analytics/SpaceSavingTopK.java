package com.forenx.sentinel.analytics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Space-Saving frequent-items counter holding at most {@code capacity} values.
 *
 * When a new value arrives and the structure is full, the value with the smallest count is
 * replaced and the newcomer inherits that count as its overestimation error. Any value whose
 * true frequency exceeds {@code total / capacity} is guaranteed to be present.
 */
final class SpaceSavingTopK {

    private final int capacity;
    private final Map<String, long[]> counters;

    SpaceSavingTopK(int capacity) {
        this.capacity = capacity;
        this.counters = new HashMap<>(capacity * 2);
    }

    synchronized void offer(String value) {
        long[] counter = counters.get(value);
        if (counter != null) {
            counter[0]++;
            return;
        }
        if (counters.size() < capacity) {
            counters.put(value, new long[] {1L, 0L});
            return;
        }
        String minKey = null;
        long min = Long.MAX_VALUE;
        for (Map.Entry<String, long[]> e : counters.entrySet()) {
            if (e.getValue()[0] < min) {
                min = e.getValue()[0];
                minKey = e.getKey();
            }
        }
        counters.remove(minKey);
        counters.put(value, new long[] {min + 1, min});
    }

    /**
     * Adds this counter's entries into {@code into} (value -> {count, error}).
     */
    synchronized void mergeInto(Map<String, long[]> into) {
        for (Map.Entry<String, long[]> e : counters.entrySet()) {
            long[] acc = into.computeIfAbsent(e.getKey(), k -> new long[2]);
            acc[0] += e.getValue()[0];
            acc[1] += e.getValue()[1];
        }
    }

    static List<TopEntry> rank(Map<String, long[]> merged, int limit) {
        List<TopEntry> entries = new ArrayList<>(merged.size());
        for (Map.Entry<String, long[]> e : merged.entrySet()) {
            entries.add(new TopEntry(e.getKey(), e.getValue()[0], e.getValue()[1]));
        }
        entries.sort(Comparator.comparingLong(TopEntry::getCount).reversed()
            .thenComparing(TopEntry::getValue));
        return entries.size() > limit ? new ArrayList<>(entries.subList(0, limit)) : entries;
    }
}
