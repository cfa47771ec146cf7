package com.forenx.sentinel.ingestion;

import com.forenx.sentinel.alert.AlertEmitter;
import com.forenx.sentinel.analytics.MetricsAggregator;
import com.forenx.sentinel.config.DetectionSettingsHolder;
import com.forenx.sentinel.config.SentinelProperties;
import com.forenx.sentinel.detection.behavior.BehaviorHit;
import com.forenx.sentinel.detection.behavior.BehavioralClassifier;
import com.forenx.sentinel.detection.behavior.DetectionMetrics;
import com.forenx.sentinel.detection.behavior.EndpointTrafficTracker;
import com.forenx.sentinel.detection.signature.SignatureClassifier;
import com.forenx.sentinel.detection.signature.SignatureHit;
import com.forenx.sentinel.domain.Alert;
import com.forenx.sentinel.domain.LogRecord;
import com.forenx.sentinel.enrichment.EnrichmentStage;
import com.forenx.sentinel.live.LiveEvent;
import com.forenx.sentinel.live.LiveEventChannel;
import com.forenx.sentinel.normalization.LineParser;
import com.forenx.sentinel.normalization.parsers.ParseException;
import com.forenx.sentinel.storage.RecordStore;
import com.forenx.sentinel.storage.StorageWriteException;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Two-stage worker pipeline from raw lines to committed records.
 *
 * <p>Stage one, the parser workers, parse, enrich and signature-classify lines. A source is
 * always routed to the same parser worker, so its lines leave stage one in file order.
 * Stage two, the behavior shards, own the behavioral state. A record is routed to the shard of
 * its client address, so each address's windows are touched by exactly one thread and in
 * order. A shard commits a record to the store, then classifies it, emits alerts, updates
 * metrics and publishes it live. A record the store rejected goes no further, and neither
 * does any later line of the same source: the caller retries those from the failed offset,
 * so they must not have touched behavioral state or metrics yet.
 *
 * <p>Both stages use bounded queues. {@link #submit} blocks while the first stage is full for
 * batch producers and returns immediately for live producers. On shutdown the pipeline stops
 * accepting lines, drains everything already queued and then stops the workers.
 */
@Component
public class IngestionPipeline {

    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    private static final long OFFER_SLICE_MILLIS = 100L;

    private final LineParser lineParser;
    private final EnrichmentStage enrichmentStage;
    private final SignatureClassifier signatureClassifier;
    private final DetectionSettingsHolder settingsHolder;
    private final EndpointTrafficTracker endpointTracker;
    private final AlertEmitter alertEmitter;
    private final MetricsAggregator metricsAggregator;
    private final RecordStore recordStore;
    private final LiveEventChannel liveChannel;
    private final IngestionMetrics metrics;
    private final Duration drainTimeout;

    private final List<BlockingQueue<ParserTask>> parserQueues = new ArrayList<>();
    private final List<BlockingQueue<ShardTask>> shardQueues = new ArrayList<>();
    private final List<BehavioralClassifier> shards = new ArrayList<>();

    private ExecutorService parserExecutor;
    private ExecutorService shardExecutor;
    private volatile boolean accepting;

    public IngestionPipeline(SentinelProperties properties, LineParser lineParser, EnrichmentStage enrichmentStage,
                             SignatureClassifier signatureClassifier, DetectionSettingsHolder settingsHolder,
                             EndpointTrafficTracker endpointTracker, DetectionMetrics detectionMetrics,
                             AlertEmitter alertEmitter, MetricsAggregator metricsAggregator, RecordStore recordStore,
                             LiveEventChannel liveChannel, IngestionMetrics metrics, MeterRegistry registry) {
        this.lineParser = lineParser;
        this.enrichmentStage = enrichmentStage;
        this.signatureClassifier = signatureClassifier;
        this.settingsHolder = settingsHolder;
        this.endpointTracker = endpointTracker;
        this.alertEmitter = alertEmitter;
        this.metricsAggregator = metricsAggregator;
        this.recordStore = recordStore;
        this.liveChannel = liveChannel;
        this.metrics = metrics;

        SentinelProperties.Ingestion cfg = properties.getIngestion();
        this.drainTimeout = cfg.getDrainTimeout();
        for (int i = 0; i < cfg.getParserWorkers(); i++) {
            parserQueues.add(new ArrayBlockingQueue<>(cfg.getQueueCapacity()));
        }
        for (int i = 0; i < cfg.getShards(); i++) {
            shardQueues.add(new ArrayBlockingQueue<>(cfg.getQueueCapacity()));
            shards.add(new BehavioralClassifier(settingsHolder, endpointTracker, detectionMetrics));
        }

        Gauge.builder("forenx.ingestion.queue.depth", this, IngestionPipeline::queueDepth)
            .description("Lines and records waiting in pipeline queues")
            .register(registry);
    }

    @PostConstruct
    public synchronized void start() {
        if (accepting) {
            return;
        }
        parserExecutor = Executors.newFixedThreadPool(parserQueues.size(),
            new ThreadFactoryBuilder().setNameFormat("forenx-parser-%d").setDaemon(true).build());
        shardExecutor = Executors.newFixedThreadPool(shardQueues.size(),
            new ThreadFactoryBuilder().setNameFormat("forenx-shard-%d").setDaemon(true).build());
        for (BlockingQueue<ParserTask> queue : parserQueues) {
            parserExecutor.execute(() -> runParser(queue));
        }
        for (int i = 0; i < shardQueues.size(); i++) {
            BlockingQueue<ShardTask> queue = shardQueues.get(i);
            BehavioralClassifier classifier = shards.get(i);
            shardExecutor.execute(() -> runShard(queue, classifier));
        }
        accepting = true;
        log.info("Ingestion pipeline started: {} parser workers, {} behavior shards",
            parserQueues.size(), shardQueues.size());
    }

    /**
     * Queues one line.
     *
     * @param block wait for queue space (batch) instead of returning false when full (live)
     * @return false if the line was not queued: the queue was full in non-blocking mode, or
     *         the pipeline is no longer accepting input
     */
    public boolean submit(String line, long lineOffset, IngestionTracker tracker, boolean block)
            throws InterruptedException {
        if (!accepting) {
            return false;
        }
        BlockingQueue<ParserTask> queue = parserQueues.get(
            Math.floorMod(tracker.getSourceFileId().hashCode(), parserQueues.size()));
        ParserTask task = new ParserTask(line, lineOffset, tracker, System.nanoTime());
        tracker.lineSubmitted();
        boolean queued;
        if (block) {
            queued = false;
            while (!queued && accepting) {
                queued = queue.offer(task, OFFER_SLICE_MILLIS, TimeUnit.MILLISECONDS);
            }
        } else {
            queued = queue.offer(task);
        }
        if (queued && !accepting && queue.remove(task)) {
            // Lost the race with shutdown; the workers may already be gone
            queued = false;
        }
        if (!queued) {
            tracker.lineDone();
            return false;
        }
        metrics.recordLineAccepted(!block);
        return true;
    }

    public boolean isAccepting() {
        return accepting;
    }

    /**
     * Purges idle behavioral state and expired coalescing entries. Each shard sweeps its own
     * state on its own thread; a shard whose queue is full skips this round.
     */
    @Scheduled(fixedDelayString = "${forenx.detection.sweep-interval:PT30S}",
        initialDelayString = "${forenx.detection.sweep-interval:PT30S}")
    public void sweep() {
        if (!accepting) {
            return;
        }
        for (BlockingQueue<ShardTask> queue : shardQueues) {
            queue.offer(ShardTask.SWEEP);
        }
        int coalescing = alertEmitter.evictExpired();
        int endpoints = endpointTracker.evictIdle(
            System.nanoTime() - settingsHolder.get().getEvictionTtl().toNanos());
        if (coalescing > 0 || endpoints > 0) {
            log.debug("Sweep removed {} coalescing entries and {} endpoint baselines", coalescing, endpoints);
        }
    }

    /**
     * Stops accepting lines, drains the queues and stops the workers.
     */
    @PreDestroy
    public synchronized void shutdown() {
        if (!accepting) {
            return;
        }
        accepting = false;
        log.info("Ingestion pipeline draining ({} queued)", queueDepth());
        long deadline = System.nanoTime() + drainTimeout.toNanos();
        try {
            for (BlockingQueue<ParserTask> queue : parserQueues) {
                queue.put(ParserTask.POISON);
            }
            parserExecutor.shutdown();
            if (!parserExecutor.awaitTermination(remaining(deadline), TimeUnit.NANOSECONDS)) {
                log.warn("Parser workers did not drain within {}", drainTimeout);
            }
            for (BlockingQueue<ShardTask> queue : shardQueues) {
                queue.put(ShardTask.POISON);
            }
            shardExecutor.shutdown();
            if (!shardExecutor.awaitTermination(remaining(deadline), TimeUnit.NANOSECONDS)) {
                log.warn("Behavior shards did not drain within {}, {} records left", drainTimeout, queueDepth());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while draining the ingestion pipeline");
        } finally {
            parserExecutor.shutdownNow();
            shardExecutor.shutdownNow();
        }
        log.info("Ingestion pipeline stopped");
    }

    public int queueDepth() {
        int depth = 0;
        for (BlockingQueue<ParserTask> q : parserQueues) {
            depth += q.size();
        }
        for (BlockingQueue<ShardTask> q : shardQueues) {
            depth += q.size();
        }
        return depth;
    }

    public List<Integer> shardQueueDepths() {
        List<Integer> depths = new ArrayList<>(shardQueues.size());
        for (BlockingQueue<ShardTask> q : shardQueues) {
            depths.add(q.size());
        }
        return depths;
    }

    private void runParser(BlockingQueue<ParserTask> queue) {
        while (true) {
            ParserTask task;
            try {
                task = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (task == ParserTask.POISON) {
                return;
            }
            if (!handleLine(task)) {
                return;
            }
        }
    }

    /**
     * @return false if the worker was interrupted and must stop
     */
    private boolean handleLine(ParserTask task) {
        IngestionTracker tracker = task.tracker;
        if (tracker.isPastStorageFailure(task.lineOffset)) {
            tracker.lineDone();
            return true;
        }
        try {
            LogRecord record = lineParser.parse(task.line, tracker.getSourceFileId(), task.lineOffset);
            LogRecord enriched = enrichmentStage.enrich(record);
            List<SignatureHit> signatureHits = signatureClassifier.classify(enriched);
            shardQueues.get(shardOf(enriched.getClientIp()))
                .put(new ShardTask(enriched, signatureHits, tracker, task.queuedAtNanos));
            return true;
        } catch (ParseException e) {
            tracker.recordParseError(task.lineOffset, e.getKind());
            tracker.lineDone();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            tracker.lineDone();
            return false;
        } catch (RuntimeException e) {
            log.error("Unexpected failure on line {} of {}", task.lineOffset, tracker.getSourceFileId(), e);
            metrics.recordProcessingFailure();
            tracker.recordProcessingError(task.lineOffset);
            tracker.lineDone();
            return true;
        }
    }

    private void runShard(BlockingQueue<ShardTask> queue, BehavioralClassifier classifier) {
        while (true) {
            ShardTask task;
            try {
                task = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (task == ShardTask.POISON) {
                return;
            }
            if (task == ShardTask.SWEEP) {
                classifier.evictIdle();
                continue;
            }
            commit(task, classifier);
        }
    }

    private void commit(ShardTask task, BehavioralClassifier classifier) {
        LogRecord record = task.record;
        IngestionTracker tracker = task.tracker;
        try {
            if (tracker.isPastStorageFailure(record.getLineOffset())) {
                log.debug("Skipping line {} of {}, behind a storage failure",
                    record.getLineOffset(), record.getSourceFileId());
                return;
            }
            recordStore.append(record);
            List<BehaviorHit> behaviorHits = classifier.observe(record);
            List<Alert> alerts = alertEmitter.emit(task.signatureHits, behaviorHits, record);
            metricsAggregator.update(record);
            liveChannel.publish(LiveEvent.recordCommitted(record));
            tracker.recordCommitted(record.getLineOffset(), alerts.size());
            metrics.recordCommitted(task.queuedAtNanos);
        } catch (StorageWriteException e) {
            log.error("Storage did not acknowledge line {} of {}: {}",
                record.getLineOffset(), record.getSourceFileId(), e.getMessage());
            metrics.recordStorageFailure();
            tracker.recordStorageFailure(record.getLineOffset(), e);
        } catch (RuntimeException e) {
            log.error("Unexpected failure committing line {} of {}",
                record.getLineOffset(), record.getSourceFileId(), e);
            metrics.recordProcessingFailure();
            tracker.recordProcessingError(record.getLineOffset());
        } finally {
            tracker.lineDone();
        }
    }

    int shardOf(String clientIp) {
        return Math.floorMod(clientIp.hashCode(), shardQueues.size());
    }

    private static long remaining(long deadlineNanos) {
        return Math.max(0L, deadlineNanos - System.nanoTime());
    }

    private static final class ParserTask {
        static final ParserTask POISON = new ParserTask(null, -1L, null, 0L);

        final String line;
        final long lineOffset;
        final IngestionTracker tracker;
        final long queuedAtNanos;

        ParserTask(String line, long lineOffset, IngestionTracker tracker, long queuedAtNanos) {
            this.line = line;
            this.lineOffset = lineOffset;
            this.tracker = tracker;
            this.queuedAtNanos = queuedAtNanos;
        }
    }

    private static final class ShardTask {
        static final ShardTask POISON = new ShardTask(null, null, null, 0L);
        static final ShardTask SWEEP = new ShardTask(null, null, null, 0L);

        final LogRecord record;
        final List<SignatureHit> signatureHits;
        final IngestionTracker tracker;
        final long queuedAtNanos;

        ShardTask(LogRecord record, List<SignatureHit> signatureHits, IngestionTracker tracker, long queuedAtNanos) {
            this.record = record;
            this.signatureHits = signatureHits;
            this.tracker = tracker;
            this.queuedAtNanos = queuedAtNanos;
        }
    }
}
