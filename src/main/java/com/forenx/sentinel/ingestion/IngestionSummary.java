package com.forenx.sentinel.ingestion;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.forenx.sentinel.normalization.parsers.ParseErrorKind;

import java.time.Instant;
import java.util.Map;

/**
 * Per-source result of an ingestion run, kept in the {@link IngestionLedger}.
 * {@code complete} is false when the run stopped early (unreadable source, storage failure,
 * shutdown); the counters then describe the lines that were processed and the content hash
 * covers the lines before the first unacknowledged one.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class IngestionSummary {

    @JsonProperty("source_file_id")
    private final String sourceFileId;

    @JsonProperty("mode")
    private final String mode;

    @JsonProperty("lines_total")
    private final long linesTotal;

    @JsonProperty("parsed_ok")
    private final long parsedOk;

    @JsonProperty("parse_errors")
    private final long parseErrors;

    @JsonProperty("parse_errors_by_kind")
    private final Map<ParseErrorKind, Long> parseErrorsByKind;

    @JsonProperty("processing_errors")
    private final long processingErrors;

    @JsonProperty("dropped")
    private final long dropped;

    @JsonProperty("alerts_raised")
    private final long alertsRaised;

    @JsonProperty("content_hash")
    private final String contentHash;

    @JsonProperty("complete")
    private final boolean complete;

    @JsonProperty("error")
    private final String error;

    @JsonProperty("first_unacknowledged_offset")
    private final Long firstUnacknowledgedOffset;

    @JsonProperty("started_at")
    private final Instant startedAt;

    @JsonProperty("finished_at")
    private final Instant finishedAt;

    private IngestionSummary(Builder b) {
        this.sourceFileId = b.sourceFileId;
        this.mode = b.mode;
        this.linesTotal = b.linesTotal;
        this.parsedOk = b.parsedOk;
        this.parseErrors = b.parseErrors;
        this.parseErrorsByKind = b.parseErrorsByKind == null ? Map.of() : Map.copyOf(b.parseErrorsByKind);
        this.processingErrors = b.processingErrors;
        this.dropped = b.dropped;
        this.alertsRaised = b.alertsRaised;
        this.contentHash = b.contentHash;
        this.complete = b.complete;
        this.error = b.error;
        this.firstUnacknowledgedOffset = b.firstUnacknowledgedOffset;
        this.startedAt = b.startedAt;
        this.finishedAt = b.finishedAt;
    }

    public static Builder builder(String sourceFileId, String mode) {
        return new Builder(sourceFileId, mode);
    }

    public String getSourceFileId() {
        return sourceFileId;
    }

    public String getMode() {
        return mode;
    }

    public long getLinesTotal() {
        return linesTotal;
    }

    public long getParsedOk() {
        return parsedOk;
    }

    public long getParseErrors() {
        return parseErrors;
    }

    public Map<ParseErrorKind, Long> getParseErrorsByKind() {
        return parseErrorsByKind;
    }

    public long getProcessingErrors() {
        return processingErrors;
    }

    public long getDropped() {
        return dropped;
    }

    public long getAlertsRaised() {
        return alertsRaised;
    }

    public String getContentHash() {
        return contentHash;
    }

    public boolean isComplete() {
        return complete;
    }

    public String getError() {
        return error;
    }

    public Long getFirstUnacknowledgedOffset() {
        return firstUnacknowledgedOffset;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    @Override
    public String toString() {
        return "IngestionSummary{" + sourceFileId + " lines=" + linesTotal + " ok=" + parsedOk
            + " errors=" + parseErrors + " complete=" + complete + " sha256=" + contentHash + "}";
    }

    public static final class Builder {
        private final String sourceFileId;
        private final String mode;
        private long linesTotal;
        private long parsedOk;
        private long parseErrors;
        private Map<ParseErrorKind, Long> parseErrorsByKind;
        private long processingErrors;
        private long dropped;
        private long alertsRaised;
        private String contentHash;
        private boolean complete;
        private String error;
        private Long firstUnacknowledgedOffset;
        private Instant startedAt;
        private Instant finishedAt;

        private Builder(String sourceFileId, String mode) {
            this.sourceFileId = sourceFileId;
            this.mode = mode;
        }

        public Builder fromTracker(IngestionTracker tracker) {
            this.parsedOk = tracker.getParsedOk();
            this.parseErrors = tracker.getParseErrors();
            this.parseErrorsByKind = tracker.getErrorsByKind();
            this.processingErrors = tracker.getProcessingErrors();
            this.alertsRaised = tracker.getAlerts();
            if (tracker.hasStorageFailure()) {
                this.firstUnacknowledgedOffset = tracker.getFirstFailedOffset();
            }
            return this;
        }

        public Builder linesTotal(long linesTotal) {
            this.linesTotal = linesTotal;
            return this;
        }

        public Builder dropped(long dropped) {
            this.dropped = dropped;
            return this;
        }

        public Builder contentHash(String contentHash) {
            this.contentHash = contentHash;
            return this;
        }

        public Builder complete(boolean complete) {
            this.complete = complete;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public IngestionSummary build() {
            return new IngestionSummary(this);
        }
    }
}
