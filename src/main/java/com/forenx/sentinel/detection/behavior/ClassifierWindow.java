package com.forenx.sentinel.detection.behavior;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;

/**
 * Sliding-window counters for one key (a client address, an address/endpoint pair, or an endpoint).
 *
 * The window is split into {@value #SLOTS} slots kept in a ring. "Now" for the window is the
 * latest event time it has seen. When an event moves now forward, slots that fall out of
 * {@code (now - length, now]} are subtracted before the event is added, so the totals always
 * describe the trailing window at slot resolution. Events older than the window are rejected.
 * The set of distinct endpoints is capped; the least recently seen endpoint is dropped first.
 *
 * Not thread-safe. A window is owned by a single behavior shard, or guarded by its caller.
 */
public final class ClassifierWindow {

    static final int SLOTS = 30;

    private final String key;
    private final long lengthMillis;
    private final long slotMillis;
    private final int maxEndpoints;

    private final long[] slotIds = new long[SLOTS];
    private final int[] events = new int[SLOTS];
    private final int[] status4xx = new int[SLOTS];
    private final int[] authFailures = new int[SLOTS];
    private final long[] bytes = new long[SLOTS];

    private final LinkedHashMap<String, Long> endpoints = new LinkedHashMap<>();

    private long headSlot = Long.MIN_VALUE;
    private long nowMillis = Long.MIN_VALUE;
    private long eventCount;
    private long status4xxCount;
    private long authFailureCount;
    private long bytesTotal;
    private long lastObservedNanos;

    public ClassifierWindow(String key, Duration length, int maxEndpoints) {
        this.key = key;
        this.lengthMillis = length.toMillis();
        this.slotMillis = Math.max(1L, lengthMillis / SLOTS);
        this.maxEndpoints = maxEndpoints;
        Arrays.fill(slotIds, Long.MIN_VALUE);
    }

    /**
     * Adds one event.
     *
     * @return false if the event is older than the window and was not counted
     */
    public boolean observe(Instant timestamp, int statusCode, long bytesSent, String endpoint) {
        long ts = timestamp.toEpochMilli();
        long slot = Math.floorDiv(ts, slotMillis);
        if (headSlot != Long.MIN_VALUE && slot <= headSlot - SLOTS) {
            return false;
        }
        if (slot > headSlot) {
            advance(slot);
        }
        if (ts > nowMillis) {
            nowMillis = ts;
        }
        int idx = (int) Math.floorMod(slot, (long) SLOTS);
        if (slotIds[idx] != slot) {
            clearSlot(idx);
            slotIds[idx] = slot;
        }
        events[idx]++;
        eventCount++;
        if (statusCode >= 400 && statusCode < 500) {
            status4xx[idx]++;
            status4xxCount++;
        }
        if (statusCode == 401 || statusCode == 403) {
            authFailures[idx]++;
            authFailureCount++;
        }
        bytes[idx] += bytesSent;
        bytesTotal += bytesSent;
        if (endpoint != null) {
            trackEndpoint(endpoint, ts);
        }
        return true;
    }

    private void advance(long slot) {
        if (headSlot == Long.MIN_VALUE || slot - headSlot >= SLOTS) {
            for (int i = 0; i < SLOTS; i++) {
                clearSlot(i);
            }
        } else {
            for (long s = headSlot + 1; s <= slot; s++) {
                clearSlot((int) Math.floorMod(s, (long) SLOTS));
            }
        }
        headSlot = slot;
        pruneEndpoints(slot * slotMillis + slotMillis - lengthMillis);
    }

    private void clearSlot(int idx) {
        eventCount -= events[idx];
        status4xxCount -= status4xx[idx];
        authFailureCount -= authFailures[idx];
        bytesTotal -= bytes[idx];
        events[idx] = 0;
        status4xx[idx] = 0;
        authFailures[idx] = 0;
        bytes[idx] = 0;
        slotIds[idx] = Long.MIN_VALUE;
    }

    private void trackEndpoint(String endpoint, long ts) {
        Long previous = endpoints.remove(endpoint);
        endpoints.put(endpoint, previous == null ? ts : Math.max(previous, ts));
        if (endpoints.size() > maxEndpoints) {
            Iterator<String> it = endpoints.keySet().iterator();
            it.next();
            it.remove();
        }
    }

    private void pruneEndpoints(long cutoffMillis) {
        endpoints.values().removeIf(seen -> seen < cutoffMillis);
    }

    /**
     * Records wall-clock activity for idle eviction, independent of event time.
     */
    void touch(long nanoTime) {
        this.lastObservedNanos = nanoTime;
    }

    /**
     * True if no event arrived since {@code cutoffNanos} (wall clock).
     */
    boolean isIdle(long cutoffNanos) {
        return lastObservedNanos - cutoffNanos < 0;
    }

    public String getKey() {
        return key;
    }

    public Duration getLength() {
        return Duration.ofMillis(lengthMillis);
    }

    /**
     * Start of the interval the counters cover.
     */
    public Instant getWindowStart() {
        return nowMillis == Long.MIN_VALUE ? null : Instant.ofEpochMilli(nowMillis - lengthMillis);
    }

    public Instant getNow() {
        return nowMillis == Long.MIN_VALUE ? null : Instant.ofEpochMilli(nowMillis);
    }

    public long getEventCount() {
        return eventCount;
    }

    public long getStatus4xxCount() {
        return status4xxCount;
    }

    public long getAuthFailureCount() {
        return authFailureCount;
    }

    public long getBytesTotal() {
        return bytesTotal;
    }

    public int getDistinctEndpoints() {
        return endpoints.size();
    }

    @Override
    public String toString() {
        return "ClassifierWindow{" + key + " events=" + eventCount + " auth=" + authFailureCount
            + " bytes=" + bytesTotal + " endpoints=" + endpoints.size() + "}";
    }
}
