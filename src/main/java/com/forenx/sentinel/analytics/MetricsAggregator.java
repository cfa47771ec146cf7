package com.forenx.sentinel.analytics;

import com.forenx.sentinel.config.SentinelProperties;
import com.forenx.sentinel.domain.LogRecord;
import com.google.common.hash.BloomFilter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Incremental time-bucketed traffic metrics.
 *
 * Every record increments exactly one bucket per {@link Granularity}. Series queries read
 * bucket counters directly and fill slots without traffic with zero buckets. Top-N and summary
 * queries cover a range with whole days where the range spans them and hours at the edges,
 * so their cost depends on the range length, never on the number of records. Ranges are
 * resolved to whole hours.
 */
@Component
public class MetricsAggregator {

    private final Map<Granularity, ConcurrentSkipListMap<Instant, MetricsBucket>> buckets =
        new EnumMap<>(Granularity.class);
    private final int topKCapacity;
    private final int expectedClients;
    private final double clientFpp;

    @Autowired
    public MetricsAggregator(SentinelProperties properties) {
        this(properties.getAnalytics().getTopKCapacity(),
            properties.getAnalytics().getUniqueClientExpected(),
            properties.getAnalytics().getUniqueClientFpp());
    }

    public MetricsAggregator(int topKCapacity, int expectedClients, double clientFpp) {
        this.topKCapacity = topKCapacity;
        this.expectedClients = expectedClients;
        this.clientFpp = clientFpp;
        for (Granularity g : Granularity.values()) {
            buckets.put(g, new ConcurrentSkipListMap<>());
        }
    }

    public void update(LogRecord record) {
        Instant ts = record.getTimestamp();
        for (Granularity g : Granularity.values()) {
            Instant start = g.bucketStart(ts);
            buckets.get(g)
                .computeIfAbsent(start, s -> new MetricsBucket(g, s, topKCapacity, expectedClients, clientFpp))
                .add(record);
        }
    }

    /**
     * Series of buckets from the bucket containing {@code from} up to {@code to} (exclusive).
     * An empty or inverted range yields the single bucket containing {@code from}.
     */
    public List<MetricsPoint> query(Instant from, Instant to, Granularity granularity) {
        ConcurrentSkipListMap<Instant, MetricsBucket> series = buckets.get(granularity);
        Instant start = granularity.bucketStart(from);
        List<MetricsPoint> points = new ArrayList<>();
        if (!to.isAfter(from)) {
            points.add(point(series, granularity, start));
            return points;
        }
        for (Instant t = start; t.isBefore(to); t = granularity.next(t)) {
            points.add(point(series, granularity, t));
        }
        return points;
    }

    public List<TopEntry> top(Dimension dimension, int limit, Instant from, Instant to) {
        Map<String, long[]> merged = new HashMap<>();
        for (MetricsBucket bucket : covering(from, to)) {
            bucket.getTopK(dimension).mergeInto(merged);
        }
        return SpaceSavingTopK.rank(merged, limit);
    }

    public MetricsSummary summary(Instant from, Instant to) {
        long requests = 0;
        long errors = 0;
        long bytes = 0;
        Map<String, Long> statusClasses = new TreeMap<>();
        Map<String, Long> methods = new TreeMap<>();
        BloomFilter<CharSequence> clients = null;

        for (MetricsBucket bucket : covering(from, to)) {
            requests += bucket.getRequests();
            errors += bucket.getErrors();
            bytes += bucket.getBytes();
            for (int c = 1; c <= 5; c++) {
                long n = bucket.getStatusClass(c);
                if (n > 0) {
                    statusClasses.merge(c + "xx", n, Long::sum);
                }
            }
            for (Map.Entry<String, LongAdder> e : bucket.getMethods().entrySet()) {
                methods.merge(e.getKey(), e.getValue().sum(), Long::sum);
            }
            if (clients == null) {
                clients = bucket.getClients().copy();
            } else {
                clients.putAll(bucket.getClients());
            }
        }
        long uniqueIps = clients == null ? 0L : clients.approximateElementCount();
        return new MetricsSummary(from, to, requests, uniqueIps, bytes, errors, statusClasses, methods);
    }

    /**
     * Existing buckets that together cover {@code [from, to)}: whole days where possible, hours otherwise.
     */
    List<MetricsBucket> covering(Instant from, Instant to) {
        List<MetricsBucket> result = new ArrayList<>();
        ConcurrentSkipListMap<Instant, MetricsBucket> hours = buckets.get(Granularity.HOUR);
        ConcurrentSkipListMap<Instant, MetricsBucket> days = buckets.get(Granularity.DAY);
        Instant t = Granularity.HOUR.bucketStart(from);
        while (t.isBefore(to)) {
            Instant nextDay = Granularity.DAY.next(t);
            if (Granularity.DAY.isAligned(t) && !nextDay.isAfter(to)) {
                addIfPresent(result, days.get(t));
                t = nextDay;
            } else {
                addIfPresent(result, hours.get(t));
                t = Granularity.HOUR.next(t);
            }
        }
        return result;
    }

    public int bucketCount(Granularity granularity) {
        return buckets.get(granularity).size();
    }

    private static void addIfPresent(List<MetricsBucket> result, MetricsBucket bucket) {
        if (bucket != null) {
            result.add(bucket);
        }
    }

    private static MetricsPoint point(ConcurrentSkipListMap<Instant, MetricsBucket> series,
                                      Granularity granularity, Instant start) {
        MetricsBucket bucket = series.get(start);
        return bucket == null ? MetricsPoint.empty(granularity, start) : bucket.snapshot();
    }
}
