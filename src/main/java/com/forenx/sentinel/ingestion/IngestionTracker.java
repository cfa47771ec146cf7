package com.forenx.sentinel.ingestion;

import com.forenx.sentinel.normalization.parsers.ParseErrorKind;
import com.forenx.sentinel.storage.StorageWriteException;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * Outcome counters for the lines of one source while they travel through the pipeline.
 * Updated from worker threads; the producer waits on it until every submitted line is done.
 *
 * <p>A batch tracker also follows which offsets were acknowledged: committed, or rejected by
 * the parser, or failed for a reason a retry would not fix. Lines finish out of order across
 * behavior shards, so it keeps the end of the contiguous acknowledged prefix plus the offsets
 * acknowledged beyond it. A line the store did not acknowledge holds the prefix back for good,
 * and once a storage failure is known no line past it is processed further.
 */
public final class IngestionTracker {

    private final String sourceFileId;
    private final LongAdder parsedOk = new LongAdder();
    private final LongAdder parseErrors = new LongAdder();
    private final LongAdder processingErrors = new LongAdder();
    private final LongAdder alerts = new LongAdder();
    private final ConcurrentHashMap<ParseErrorKind, LongAdder> errorsByKind = new ConcurrentHashMap<>();
    private final AtomicLong firstFailedOffset = new AtomicLong(Long.MAX_VALUE);
    private final AtomicReference<StorageWriteException> storageFailure = new AtomicReference<>();

    private final Object monitor = new Object();
    private long pending;

    private final boolean tracksOffsets;
    private long acknowledgedPrefix;
    private final TreeSet<Long> acknowledgedAhead = new TreeSet<>();

    /**
     * Tracker without offset acknowledgement, for live sources.
     */
    public IngestionTracker(String sourceFileId) {
        this(sourceFileId, false, 0L);
    }

    private IngestionTracker(String sourceFileId, boolean tracksOffsets, long startOffset) {
        this.sourceFileId = sourceFileId;
        this.tracksOffsets = tracksOffsets;
        this.acknowledgedPrefix = startOffset;
    }

    /**
     * Tracker for a batch whose first line has offset {@code startOffset}.
     */
    public static IngestionTracker forBatch(String sourceFileId, long startOffset) {
        return new IngestionTracker(sourceFileId, true, startOffset);
    }

    void lineSubmitted() {
        synchronized (monitor) {
            pending++;
        }
    }

    void lineDone() {
        synchronized (monitor) {
            pending--;
            if (pending == 0) {
                monitor.notifyAll();
            }
        }
    }

    void recordCommitted(long lineOffset, int alertCount) {
        parsedOk.increment();
        alerts.add(alertCount);
        acknowledge(lineOffset);
    }

    void recordParseError(long lineOffset, ParseErrorKind kind) {
        parseErrors.increment();
        errorsByKind.computeIfAbsent(kind, k -> new LongAdder()).increment();
        acknowledge(lineOffset);
    }

    void recordProcessingError(long lineOffset) {
        processingErrors.increment();
        acknowledge(lineOffset);
    }

    /**
     * Marks a line as handled without it passing through the pipeline, e.g. a line a previous
     * attempt already acknowledged.
     */
    void acknowledge(long lineOffset) {
        if (!tracksOffsets) {
            return;
        }
        synchronized (monitor) {
            if (lineOffset < acknowledgedPrefix) {
                return;
            }
            if (lineOffset > acknowledgedPrefix) {
                acknowledgedAhead.add(lineOffset);
                return;
            }
            acknowledgedPrefix++;
            while (!acknowledgedAhead.isEmpty() && acknowledgedAhead.first() == acknowledgedPrefix) {
                acknowledgedAhead.pollFirst();
                acknowledgedPrefix++;
            }
        }
    }

    /**
     * True if a storage failure was recorded at an offset before this one. Such lines are
     * left for the retry.
     */
    boolean isPastStorageFailure(long lineOffset) {
        return storageFailure.get() != null && lineOffset > firstFailedOffset.get();
    }

    void recordStorageFailure(long lineOffset, StorageWriteException e) {
        firstFailedOffset.accumulateAndGet(lineOffset, Math::min);
        storageFailure.compareAndSet(null, e);
    }

    /**
     * Waits until every submitted line has been committed or rejected.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitDrained(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (monitor) {
            while (pending > 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                monitor.wait(Math.max(1L, remaining / 1_000_000L));
            }
            return true;
        }
    }

    public String getSourceFileId() {
        return sourceFileId;
    }

    public long getPending() {
        synchronized (monitor) {
            return pending;
        }
    }

    public long getParsedOk() {
        return parsedOk.sum();
    }

    public long getParseErrors() {
        return parseErrors.sum();
    }

    public long getProcessingErrors() {
        return processingErrors.sum();
    }

    public long getAlerts() {
        return alerts.sum();
    }

    public Map<ParseErrorKind, Long> getErrorsByKind() {
        Map<ParseErrorKind, Long> copy = new EnumMap<>(ParseErrorKind.class);
        errorsByKind.forEach((k, v) -> copy.put(k, v.sum()));
        return copy;
    }

    public boolean hasStorageFailure() {
        return storageFailure.get() != null;
    }

    public StorageWriteException getStorageFailure() {
        return storageFailure.get();
    }

    /**
     * @return offset one past the contiguous run of acknowledged lines
     */
    public long getAcknowledgedPrefix() {
        synchronized (monitor) {
            return acknowledgedPrefix;
        }
    }

    /**
     * @return acknowledged offsets after the first unacknowledged one, ascending
     */
    public SortedSet<Long> getAcknowledgedAhead() {
        synchronized (monitor) {
            return new TreeSet<>(acknowledgedAhead);
        }
    }

    /**
     * @return offset of the first line whose record was not acknowledged, or -1
     */
    public long getFirstFailedOffset() {
        long offset = firstFailedOffset.get();
        return offset == Long.MAX_VALUE ? -1L : offset;
    }
}
