package com.forenx.sentinel.analytics;

import com.forenx.sentinel.domain.LogRecord;
import com.google.common.hash.BloomFilter;
import com.google.common.hash.Funnels;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Live counters for one time slot of one granularity. Updates are commutative increments and
 * safe from any thread; the Bloom filter is Guava's lock-free implementation.
 */
final class MetricsBucket {

    private final Granularity granularity;
    private final Instant bucketStart;

    private final LongAdder requests = new LongAdder();
    private final LongAdder errors = new LongAdder();
    private final LongAdder bytes = new LongAdder();
    private final LongAdder[] statusClasses = new LongAdder[6];
    private final ConcurrentHashMap<String, LongAdder> methods = new ConcurrentHashMap<>();
    private final BloomFilter<CharSequence> clients;
    private final Map<Dimension, SpaceSavingTopK> topK = new EnumMap<>(Dimension.class);

    MetricsBucket(Granularity granularity, Instant bucketStart, int topKCapacity,
                  int expectedClients, double clientFpp) {
        this.granularity = granularity;
        this.bucketStart = bucketStart;
        this.clients = BloomFilter.create(Funnels.stringFunnel(StandardCharsets.UTF_8), expectedClients, clientFpp);
        for (int i = 0; i < statusClasses.length; i++) {
            statusClasses[i] = new LongAdder();
        }
        for (Dimension dimension : Dimension.values()) {
            topK.put(dimension, new SpaceSavingTopK(topKCapacity));
        }
    }

    void add(LogRecord record) {
        requests.increment();
        if (record.isError()) {
            errors.increment();
        }
        bytes.add(record.getBytesSent());
        statusClasses[record.getStatusCode() / 100].increment();
        String method = record.getMethod() == null ? "-" : record.getMethod();
        methods.computeIfAbsent(method, k -> new LongAdder()).increment();
        clients.put(record.getClientIp());
        for (Map.Entry<Dimension, SpaceSavingTopK> e : topK.entrySet()) {
            e.getValue().offer(e.getKey().extract(record));
        }
    }

    MetricsPoint snapshot() {
        return new MetricsPoint(granularity, bucketStart, requests.sum(), errors.sum(), bytes.sum(),
            clients.approximateElementCount());
    }

    Granularity getGranularity() {
        return granularity;
    }

    Instant getBucketStart() {
        return bucketStart;
    }

    long getRequests() {
        return requests.sum();
    }

    long getErrors() {
        return errors.sum();
    }

    long getBytes() {
        return bytes.sum();
    }

    long getStatusClass(int hundreds) {
        return statusClasses[hundreds].sum();
    }

    Map<String, LongAdder> getMethods() {
        return methods;
    }

    BloomFilter<CharSequence> getClients() {
        return clients;
    }

    SpaceSavingTopK getTopK(Dimension dimension) {
        return topK.get(dimension);
    }
}
