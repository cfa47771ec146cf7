package com.forenx.sentinel.ingestion;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Counters for the ingestion pipeline. The live drop counter is also reported by the status endpoint.
 */
@Component
public class IngestionMetrics {

    private final Counter batchLines;
    private final Counter liveLines;
    private final Counter liveDropped;
    private final Counter committed;
    private final Counter storageFailures;
    private final Counter processingFailures;
    private final Timer latency;

    public IngestionMetrics(MeterRegistry registry) {
        this.batchLines = Counter.builder("forenx.ingestion.lines")
            .description("Lines accepted into the pipeline")
            .tag("mode", "batch")
            .register(registry);
        this.liveLines = Counter.builder("forenx.ingestion.lines")
            .description("Lines accepted into the pipeline")
            .tag("mode", "live")
            .register(registry);
        this.liveDropped = Counter.builder("forenx.ingestion.live.dropped")
            .description("Live-tail lines dropped because the queue was full")
            .register(registry);
        this.committed = Counter.builder("forenx.ingestion.committed")
            .description("Records committed to the record store")
            .register(registry);
        this.storageFailures = Counter.builder("forenx.ingestion.storage.failures")
            .description("Records or alerts the store did not acknowledge")
            .register(registry);
        this.processingFailures = Counter.builder("forenx.ingestion.processing.failures")
            .description("Lines that failed with an unexpected error")
            .register(registry);
        this.latency = Timer.builder("forenx.ingestion.latency")
            .description("Time from queueing a line to committing its record")
            .register(registry);
    }

    public void recordLineAccepted(boolean live) {
        (live ? liveLines : batchLines).increment();
    }

    public void recordLiveDropped() {
        liveDropped.increment();
    }

    public void recordCommitted(long queuedAtNanos) {
        committed.increment();
        latency.record(System.nanoTime() - queuedAtNanos, TimeUnit.NANOSECONDS);
    }

    public void recordStorageFailure() {
        storageFailures.increment();
    }

    public void recordProcessingFailure() {
        processingFailures.increment();
    }

    public long getLiveDroppedCount() {
        return (long) liveDropped.count();
    }

    public long getCommittedCount() {
        return (long) committed.count();
    }
}
