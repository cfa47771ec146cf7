package com.forenx.sentinel.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one non-blocking live submission.
 */
public final class LiveIngestResult {

    @JsonProperty("source_file_id")
    private final String sourceFileId;

    @JsonProperty("accepted")
    private final long accepted;

    @JsonProperty("dropped")
    private final long dropped;

    @JsonProperty("dropped_total")
    private final long droppedTotal;

    public LiveIngestResult(String sourceFileId, long accepted, long dropped, long droppedTotal) {
        this.sourceFileId = sourceFileId;
        this.accepted = accepted;
        this.dropped = dropped;
        this.droppedTotal = droppedTotal;
    }

    public String getSourceFileId() {
        return sourceFileId;
    }

    public long getAccepted() {
        return accepted;
    }

    public long getDropped() {
        return dropped;
    }

    public long getDroppedTotal() {
        return droppedTotal;
    }
}
