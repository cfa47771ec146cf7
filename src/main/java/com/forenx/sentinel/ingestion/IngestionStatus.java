package com.forenx.sentinel.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public final class IngestionStatus {

    @JsonProperty("accepting")
    private final boolean accepting;

    @JsonProperty("queue_depth")
    private final int queueDepth;

    @JsonProperty("shard_queue_depths")
    private final List<Integer> shardQueueDepths;

    @JsonProperty("live_sessions")
    private final int liveSessions;

    @JsonProperty("live_dropped_total")
    private final long liveDroppedTotal;

    @JsonProperty("records_committed")
    private final long recordsCommitted;

    @JsonProperty("live_subscribers")
    private final int liveSubscribers;

    public IngestionStatus(boolean accepting, int queueDepth, List<Integer> shardQueueDepths, int liveSessions,
                           long liveDroppedTotal, long recordsCommitted, int liveSubscribers) {
        this.accepting = accepting;
        this.queueDepth = queueDepth;
        this.shardQueueDepths = List.copyOf(shardQueueDepths);
        this.liveSessions = liveSessions;
        this.liveDroppedTotal = liveDroppedTotal;
        this.recordsCommitted = recordsCommitted;
        this.liveSubscribers = liveSubscribers;
    }

    public boolean isAccepting() {
        return accepting;
    }

    public int getQueueDepth() {
        return queueDepth;
    }

    public List<Integer> getShardQueueDepths() {
        return shardQueueDepths;
    }

    public int getLiveSessions() {
        return liveSessions;
    }

    public long getLiveDroppedTotal() {
        return liveDroppedTotal;
    }

    public long getRecordsCommitted() {
        return recordsCommitted;
    }

    public int getLiveSubscribers() {
        return liveSubscribers;
    }
}
