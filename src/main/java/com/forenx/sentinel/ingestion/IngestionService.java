package com.forenx.sentinel.ingestion;

import com.forenx.sentinel.config.SentinelProperties;
import com.forenx.sentinel.live.LiveEventChannel;
import com.forenx.sentinel.storage.StorageWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Producer side of the ingestion pipeline.
 *
 * <p>Batch mode reads a finite source, blocks while the pipeline is full, waits for every line
 * to be committed or rejected and returns a summary with the SHA-256 of the acknowledged
 * content. A parse error never stops a batch. A storage failure stops reading, is recorded in
 * the ledger and is then rethrown with the first unacknowledged offset. An unreadable source
 * ends only that source, with the failure reported in its summary.
 *
 * <p>Live mode never blocks: lines that do not fit are dropped and counted. A live session is
 * summarized when it is closed.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    static final String MODE_BATCH = "batch";
    static final String MODE_LIVE = "live";

    private final IngestionPipeline pipeline;
    private final IngestionLedger ledger;
    private final IngestionMetrics metrics;
    private final LiveEventChannel liveChannel;
    private final Duration drainTimeout;

    private final ConcurrentHashMap<String, LiveSession> liveSessions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ResumePoint> resumePoints = new ConcurrentHashMap<>();

    public IngestionService(IngestionPipeline pipeline, IngestionLedger ledger, IngestionMetrics metrics,
                            LiveEventChannel liveChannel, SentinelProperties properties) {
        this.pipeline = pipeline;
        this.ledger = ledger;
        this.metrics = metrics;
        this.liveChannel = liveChannel;
        this.drainTimeout = properties.getIngestion().getDrainTimeout();
    }

    public IngestionSummary ingestBatch(String sourceFileId, String content) {
        return ingestBatch(sourceFileId, SourceLineReader.of(content), 0L);
    }

    /**
     * Ingests every line of {@code reader}, numbering lines from {@code startOffset} so a
     * batch retried after a storage failure keeps its original record ids. When the retry
     * starts at the offset the failure reported, lines the failed attempt had already
     * acknowledged are not processed again.
     *
     * <p>The content hash covers the exact bytes of the acknowledged prefix of the batch: all
     * lines when it completes, the lines before the first unacknowledged one when storage fails.
     *
     * @throws StorageWriteException if a record was not acknowledged
     * @throws CapacityExceededException if the pipeline is not accepting input
     */
    public IngestionSummary ingestBatch(String sourceFileId, SourceLineReader reader, long startOffset) {
        if (!pipeline.isAccepting()) {
            throw new CapacityExceededException("Ingestion pipeline is not accepting input");
        }
        Instant startedAt = Instant.now();
        IngestionTracker tracker = IngestionTracker.forBatch(sourceFileId, startOffset);
        PrefixStamp stamp = new PrefixStamp(startOffset);
        Set<Long> alreadyAcknowledged = resumeState(sourceFileId, startOffset);
        String error = null;
        long offset = startOffset;

        try {
            SourceLineReader.Line line;
            while ((line = reader.next()) != null) {
                if (tracker.hasStorageFailure()) {
                    error = "storage write failure";
                    break;
                }
                stamp.add(line.getRaw());
                if (alreadyAcknowledged.contains(offset)) {
                    tracker.acknowledge(offset);
                } else if (!pipeline.submit(line.getText(), offset, tracker, true)) {
                    stamp.discardLast();
                    error = "ingestion stopped before end of source";
                    break;
                }
                offset++;
                stamp.advance(tracker.getAcknowledgedPrefix());
            }
        } catch (IOException e) {
            log.warn("Source {} unreadable after {} lines: {}", sourceFileId, offset - startOffset, e.getMessage());
            error = "source unreadable: " + e.getMessage();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            error = "interrupted";
        }

        boolean drained = awaitDrained(tracker);
        if (!drained && error == null) {
            error = "pipeline did not drain within " + drainTimeout;
        }
        if (tracker.hasStorageFailure()) {
            error = "storage write failure: " + tracker.getStorageFailure().getMessage();
            resumePoints.put(sourceFileId,
                new ResumePoint(tracker.getFirstFailedOffset(), tracker.getAcknowledgedAhead()));
        } else if (error == null) {
            resumePoints.remove(sourceFileId);
        }
        stamp.advance(tracker.getAcknowledgedPrefix());

        IngestionSummary summary = IngestionSummary.builder(sourceFileId, MODE_BATCH)
            .fromTracker(tracker)
            .linesTotal(offset - startOffset)
            .contentHash(stamp.finish())
            .complete(error == null)
            .error(error)
            .startedAt(startedAt)
            .finishedAt(Instant.now())
            .build();
        ledger.record(summary);
        log.info("Batch {} done: {} lines, {} parsed, {} parse errors, sha256 {}{}", sourceFileId,
            summary.getLinesTotal(), summary.getParsedOk(), summary.getParseErrors(), summary.getContentHash(),
            summary.isComplete() ? "" : " (incomplete: " + error + ")");

        if (tracker.hasStorageFailure()) {
            throw tracker.getStorageFailure().atOffset(sourceFileId, tracker.getFirstFailedOffset());
        }
        return summary;
    }

    private Set<Long> resumeState(String sourceFileId, long startOffset) {
        ResumePoint resume = resumePoints.get(sourceFileId);
        if (resume == null || resume.offset != startOffset) {
            return Set.of();
        }
        log.info("Resuming {} at line {}, {} later lines already acknowledged",
            sourceFileId, startOffset, resume.acknowledgedAhead.size());
        return resume.acknowledgedAhead;
    }

    /**
     * Ingests files one after another. A file that cannot be opened or read is reported in its
     * summary and does not stop the others.
     */
    public List<IngestionSummary> ingestFiles(List<Path> files) {
        List<IngestionSummary> summaries = new ArrayList<>(files.size());
        for (Path file : files) {
            String sourceFileId = file.getFileName().toString();
            try (SourceLineReader reader = LogFileReader.open(file)) {
                summaries.add(ingestBatch(sourceFileId, reader, 0L));
            } catch (IOException e) {
                log.warn("Cannot open {}: {}", file, e.getMessage());
                IngestionSummary failed = IngestionSummary.builder(sourceFileId, MODE_BATCH)
                    .contentHash(new IntegrityStamp().finish())
                    .complete(false)
                    .error("source unreadable: " + e.getMessage())
                    .startedAt(Instant.now())
                    .finishedAt(Instant.now())
                    .build();
                ledger.record(failed);
                summaries.add(failed);
            }
        }
        return summaries;
    }

    /**
     * Offers lines of a live source without blocking.
     *
     * @throws CapacityExceededException if the pipeline is not accepting input at all
     */
    public LiveIngestResult submitLive(String sourceFileId, List<String> lines) {
        if (!pipeline.isAccepting()) {
            throw new CapacityExceededException("Ingestion pipeline is not accepting input");
        }
        LiveSession session = liveSessions.computeIfAbsent(sourceFileId, LiveSession::new);
        long accepted = 0;
        long dropped = 0;
        synchronized (session) {
            for (String line : lines) {
                boolean queued;
                try {
                    queued = pipeline.submit(line, session.nextOffset.get(), session.tracker, false);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    queued = false;
                }
                session.nextOffset.incrementAndGet();
                if (queued) {
                    session.stamp.update(line);
                    accepted++;
                } else {
                    dropped++;
                    session.dropped.incrementAndGet();
                    metrics.recordLiveDropped();
                }
            }
        }
        if (dropped > 0) {
            log.warn("Live source {} dropped {} of {} lines, queue full", sourceFileId, dropped, lines.size());
        }
        return new LiveIngestResult(sourceFileId, accepted, dropped, session.dropped.get());
    }

    /**
     * Ends a live session and returns its summary, or null if no such session is open.
     */
    public IngestionSummary closeLive(String sourceFileId) {
        LiveSession session = liveSessions.remove(sourceFileId);
        if (session == null) {
            return null;
        }
        IngestionSummary summary;
        synchronized (session) {
            boolean drained = awaitDrained(session.tracker);
            summary = IngestionSummary.builder(sourceFileId, MODE_LIVE)
                .fromTracker(session.tracker)
                .linesTotal(session.stamp.getLines())
                .dropped(session.dropped.get())
                .contentHash(session.stamp.finish())
                .complete(drained && session.dropped.get() == 0 && !session.tracker.hasStorageFailure())
                .error(session.tracker.hasStorageFailure() ? "storage write failure" : null)
                .startedAt(session.startedAt)
                .finishedAt(Instant.now())
                .build();
        }
        ledger.record(summary);
        log.info("Live source {} closed: {}", sourceFileId, summary);
        return summary;
    }

    public IngestionStatus status() {
        return new IngestionStatus(pipeline.isAccepting(), pipeline.queueDepth(), pipeline.shardQueueDepths(),
            liveSessions.size(), metrics.getLiveDroppedCount(), metrics.getCommittedCount(),
            liveChannel.subscriberCount());
    }

    private boolean awaitDrained(IngestionTracker tracker) {
        try {
            return tracker.awaitDrained(drainTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Hashes batch lines in offset order, but only up to the acknowledged prefix. Lines read
     * ahead of it wait here until they are acknowledged or the batch ends.
     */
    private static final class PrefixStamp {
        private final IntegrityStamp stamp = new IntegrityStamp();
        private final ArrayDeque<byte[]> waiting = new ArrayDeque<>();
        private long nextOffset;

        PrefixStamp(long startOffset) {
            this.nextOffset = startOffset;
        }

        void add(byte[] rawLine) {
            waiting.addLast(rawLine);
        }

        void discardLast() {
            waiting.pollLast();
        }

        void advance(long acknowledgedPrefix) {
            while (nextOffset < acknowledgedPrefix && !waiting.isEmpty()) {
                stamp.update(waiting.pollFirst());
                nextOffset++;
            }
        }

        String finish() {
            waiting.clear();
            return stamp.finish();
        }
    }

    private static final class ResumePoint {
        final long offset;
        final Set<Long> acknowledgedAhead;

        ResumePoint(long offset, Set<Long> acknowledgedAhead) {
            this.offset = offset;
            this.acknowledgedAhead = acknowledgedAhead;
        }
    }

    private static final class LiveSession {
        final IngestionTracker tracker;
        final IntegrityStamp stamp = new IntegrityStamp();
        final AtomicLong nextOffset = new AtomicLong();
        final AtomicLong dropped = new AtomicLong();
        final Instant startedAt = Instant.now();

        LiveSession(String sourceFileId) {
            this.tracker = new IngestionTracker(sourceFileId);
        }
    }
}
