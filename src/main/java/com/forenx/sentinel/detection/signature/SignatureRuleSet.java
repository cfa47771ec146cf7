package com.forenx.sentinel.detection.signature;

import com.forenx.sentinel.config.ClassifierConfigException;
import com.forenx.sentinel.domain.AttackType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Validated, compiled set of signature rules. Immutable; a reload builds a new set.
 */
public final class SignatureRuleSet {

    private final List<CompiledRule> rules;
    private final String origin;

    private SignatureRuleSet(List<CompiledRule> rules, String origin) {
        this.rules = Collections.unmodifiableList(rules);
        this.origin = origin;
    }

    /**
     * Compiles and validates the rules.
     *
     * @throws ClassifierConfigException on an empty set, a duplicate or missing id, a non-signature
     *                                   attack type, a confidence outside (0, 1], an unknown target or
     *                                   a pattern that does not compile
     */
    public static SignatureRuleSet compile(List<SignatureRule> definitions, String origin) {
        if (definitions == null || definitions.isEmpty()) {
            throw new ClassifierConfigException("Signature rule set " + origin + " defines no rules");
        }
        List<CompiledRule> compiled = new ArrayList<>(definitions.size());
        Set<String> ids = new HashSet<>();
        for (SignatureRule rule : definitions) {
            String id = rule.getId();
            if (id == null || id.isBlank()) {
                throw new ClassifierConfigException("Signature rule without id in " + origin);
            }
            if (!ids.add(id)) {
                throw new ClassifierConfigException("Duplicate signature rule id " + id, id);
            }
            if (rule.getAttackType() == null || rule.getAttackType().getSource() != AttackType.Source.SIGNATURE) {
                throw new ClassifierConfigException("Rule " + id + " must declare a signature attack type, got "
                    + rule.getAttackType(), id);
            }
            if (!(rule.getConfidence() > 0.0 && rule.getConfidence() <= 1.0)) {
                throw new ClassifierConfigException("Rule " + id + " confidence must be within (0, 1]", id);
            }
            if (rule.getPattern() == null || rule.getPattern().isEmpty()) {
                throw new ClassifierConfigException("Rule " + id + " has no pattern", id);
            }
            Set<RequestTarget> targets = EnumSet.noneOf(RequestTarget.class);
            List<String> targetNames = rule.getTargets();
            if (targetNames == null || targetNames.isEmpty()) {
                throw new ClassifierConfigException("Rule " + id + " has no targets", id);
            }
            for (String name : targetNames) {
                try {
                    targets.add(RequestTarget.fromName(name));
                } catch (IllegalArgumentException e) {
                    throw new ClassifierConfigException("Rule " + id + ": " + e.getMessage(), id, e);
                }
            }
            Pattern pattern;
            try {
                pattern = Pattern.compile(rule.getPattern(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            } catch (PatternSyntaxException e) {
                throw new ClassifierConfigException("Rule " + id + " pattern does not compile: "
                    + e.getDescription(), id, e);
            }
            compiled.add(new CompiledRule(id, rule.getAttackType(), pattern, rule.getConfidence(), targets));
        }
        return new SignatureRuleSet(compiled, origin);
    }

    public List<CompiledRule> getRules() {
        return rules;
    }

    public String getOrigin() {
        return origin;
    }

    public int size() {
        return rules.size();
    }

    public static final class CompiledRule {
        private final String id;
        private final AttackType attackType;
        private final Pattern pattern;
        private final double confidence;
        private final Set<RequestTarget> targets;

        CompiledRule(String id, AttackType attackType, Pattern pattern, double confidence, Set<RequestTarget> targets) {
            this.id = id;
            this.attackType = attackType;
            this.pattern = pattern;
            this.confidence = confidence;
            this.targets = Collections.unmodifiableSet(targets);
        }

        public String getId() {
            return id;
        }

        public AttackType getAttackType() {
            return attackType;
        }

        public Pattern getPattern() {
            return pattern;
        }

        public double getConfidence() {
            return confidence;
        }

        public Set<RequestTarget> getTargets() {
            return targets;
        }
    }
}
