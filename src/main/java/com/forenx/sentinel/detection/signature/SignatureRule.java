package com.forenx.sentinel.detection.signature;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.forenx.sentinel.domain.AttackType;

import java.util.ArrayList;
import java.util.List;

/**
 * One signature rule as written in the rule file.
 *
 * <pre>
 * - id: sqli-union-select
 *   attack_type: SQLInjection
 *   pattern: 'union\s+(all\s+)?select\b'
 *   confidence: 0.85
 *   targets: [path, query]
 * </pre>
 *
 * Patterns are matched case-insensitively against normalized request text, see
 * {@link SignatureClassifier}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SignatureRule {

    @JsonProperty("id")
    private String id;

    @JsonProperty("attack_type")
    private AttackType attackType;

    @JsonProperty("pattern")
    private String pattern;

    @JsonProperty("confidence")
    private double confidence;

    @JsonProperty("description")
    private String description;

    @JsonProperty("targets")
    private List<String> targets = new ArrayList<>(List.of(
        RequestTarget.PATH.getName(), RequestTarget.QUERY.getName(), RequestTarget.EXTRAS.getName()));

    public SignatureRule() {
    }

    public SignatureRule(String id, AttackType attackType, String pattern, double confidence) {
        this.id = id;
        this.attackType = attackType;
        this.pattern = pattern;
        this.confidence = confidence;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public AttackType getAttackType() {
        return attackType;
    }

    public void setAttackType(AttackType attackType) {
        this.attackType = attackType;
    }

    public String getPattern() {
        return pattern;
    }

    public void setPattern(String pattern) {
        this.pattern = pattern;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public List<String> getTargets() {
        return targets;
    }

    public void setTargets(List<String> targets) {
        this.targets = targets;
    }
}
