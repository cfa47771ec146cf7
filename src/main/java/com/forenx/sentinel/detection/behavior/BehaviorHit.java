package com.forenx.sentinel.detection.behavior;

import com.forenx.sentinel.domain.AttackType;

/**
 * A behavioral threshold crossing observed while classifying one record.
 * {@link #ANY} in the client or endpoint position means the hit covers all of them.
 */
public final class BehaviorHit {

    public static final String ANY = "*";

    private final AttackType attackType;
    private final String clientIp;
    private final String endpoint;
    private final double confidence;
    private final long observed;
    private final long threshold;
    private final String evidence;

    public BehaviorHit(AttackType attackType, String clientIp, String endpoint, double confidence,
                       long observed, long threshold, String evidence) {
        this.attackType = attackType;
        this.clientIp = clientIp;
        this.endpoint = endpoint;
        this.confidence = confidence;
        this.observed = observed;
        this.threshold = threshold;
        this.evidence = evidence;
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

    public long getObserved() {
        return observed;
    }

    public long getThreshold() {
        return threshold;
    }

    public String getEvidence() {
        return evidence;
    }

    @Override
    public String toString() {
        return "BehaviorHit{" + attackType.getValue() + " " + clientIp + " " + endpoint
            + " " + observed + "/" + threshold + " confidence=" + confidence + "}";
    }
}
