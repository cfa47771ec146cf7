package com.forenx.sentinel.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A positive classification produced by the alert emitter.
 *
 * The id is a deterministic hash of type, client, endpoint and the event time of the first
 * trigger. A repeated trigger inside the coalescing interval folds into the same id, so the
 * stored alert is upserted rather than duplicated.
 */
public final class Alert {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("timestamp")
    private final Instant timestamp;

    @JsonProperty("attack_type")
    private final AttackType attackType;

    @JsonProperty("client_ip")
    private final String clientIp;

    @JsonProperty("endpoint")
    private final String endpoint;

    @JsonProperty("confidence")
    private final double confidence;

    @JsonProperty("evidence")
    private final String evidence;

    @JsonProperty("source_record_ids")
    private final List<String> sourceRecordIds;

    @JsonProperty("trigger_count")
    private final int triggerCount;

    public Alert(String id, Instant timestamp, AttackType attackType, String clientIp, String endpoint,
                 double confidence, String evidence, List<String> sourceRecordIds, int triggerCount) {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        this.id = Objects.requireNonNull(id, "id");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.attackType = Objects.requireNonNull(attackType, "attackType");
        this.clientIp = clientIp;
        this.endpoint = endpoint;
        this.confidence = confidence;
        this.evidence = evidence;
        this.sourceRecordIds = Collections.unmodifiableList(new ArrayList<>(sourceRecordIds));
        this.triggerCount = triggerCount;
    }

    /**
     * Returns the alert that results from folding another trigger of the same identity into this one.
     * The earliest timestamp and the id are kept; confidence rises to the maximum observed.
     */
    public Alert mergeWith(double otherConfidence, String otherEvidence, List<String> otherRecordIds,
                           int maxSourceRecords) {
        Set<String> records = new LinkedHashSet<>(sourceRecordIds);
        for (String recordId : otherRecordIds) {
            if (records.size() >= maxSourceRecords) {
                break;
            }
            records.add(recordId);
        }
        boolean stronger = otherConfidence > confidence;
        return new Alert(id, timestamp, attackType, clientIp, endpoint,
            Math.max(confidence, otherConfidence),
            stronger ? otherEvidence : evidence,
            new ArrayList<>(records),
            triggerCount + 1);
    }

    public String getId() {
        return id;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public AttackType getAttackType() {
        return attackType;
    }

    public String getClientIp() {
        return clientIp;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getEvidence() {
        return evidence;
    }

    public List<String> getSourceRecordIds() {
        return sourceRecordIds;
    }

    public int getTriggerCount() {
        return triggerCount;
    }

    @Override
    public String toString() {
        return "Alert{" + attackType.getValue() + " " + clientIp + " " + endpoint
            + " confidence=" + confidence + " id=" + id + "}";
    }
}
