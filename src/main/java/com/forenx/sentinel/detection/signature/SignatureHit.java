package com.forenx.sentinel.detection.signature;

import com.forenx.sentinel.domain.AttackType;

import java.util.List;
import java.util.Objects;

/**
 * All rules of one attack type that matched a single record, with their combined confidence.
 */
public final class SignatureHit {

    private final AttackType attackType;
    private final double confidence;
    private final List<String> ruleIds;
    private final String evidence;

    public SignatureHit(AttackType attackType, double confidence, List<String> ruleIds, String evidence) {
        this.attackType = attackType;
        this.confidence = confidence;
        this.ruleIds = List.copyOf(ruleIds);
        this.evidence = evidence;
    }

    public AttackType getAttackType() {
        return attackType;
    }

    public double getConfidence() {
        return confidence;
    }

    public List<String> getRuleIds() {
        return ruleIds;
    }

    public String getEvidence() {
        return evidence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SignatureHit)) {
            return false;
        }
        SignatureHit that = (SignatureHit) o;
        return Double.compare(that.confidence, confidence) == 0
            && attackType == that.attackType
            && ruleIds.equals(that.ruleIds)
            && Objects.equals(evidence, that.evidence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attackType, confidence, ruleIds, evidence);
    }

    @Override
    public String toString() {
        return "SignatureHit{" + attackType.getValue() + " " + confidence + " " + ruleIds + "}";
    }
}
