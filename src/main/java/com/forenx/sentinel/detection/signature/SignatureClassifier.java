package com.forenx.sentinel.detection.signature;

import com.forenx.sentinel.domain.AttackType;
import com.forenx.sentinel.domain.LogRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stateless per-record classifier for injection, scripting and traversal signatures.
 *
 * Each target field is examined in two forms: the lowercased raw text, and a normalized form
 * that is URL-decoded up to twice (double encoding) with whitespace runs collapsed to a single
 * space. All rules of an attack type that match contribute to one {@link SignatureHit} whose
 * confidence is the noisy-OR of the rule confidences, {@code 1 - prod(1 - c_i)}, capped at
 * {@value #MAX_CONFIDENCE}. Rules are evaluated in file order and hits are returned in
 * {@link AttackType} order, so the result for a given record never varies.
 */
public class SignatureClassifier {

    private static final Logger log = LoggerFactory.getLogger(SignatureClassifier.class);

    static final double MAX_CONFIDENCE = 0.99;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MAX_EVIDENCE_LENGTH = 120;

    private volatile SignatureRuleSet ruleSet;

    public SignatureClassifier(SignatureRuleSet ruleSet) {
        this.ruleSet = ruleSet;
    }

    public List<SignatureHit> classify(LogRecord record) {
        SignatureRuleSet rules = this.ruleSet;
        Map<RequestTarget, List<String>> texts = extractTexts(record);

        Map<AttackType, List<Match>> matches = new EnumMap<>(AttackType.class);
        for (SignatureRuleSet.CompiledRule rule : rules.getRules()) {
            Match match = firstMatch(rule, texts);
            if (match != null) {
                matches.computeIfAbsent(rule.getAttackType(), k -> new ArrayList<>()).add(match);
            }
        }
        if (matches.isEmpty()) {
            return List.of();
        }

        List<SignatureHit> hits = new ArrayList<>(matches.size());
        for (Map.Entry<AttackType, List<Match>> entry : matches.entrySet()) {
            hits.add(toHit(entry.getKey(), entry.getValue()));
        }
        if (log.isDebugEnabled()) {
            log.debug("Record {} matched {}", record.getId(), hits);
        }
        return hits;
    }

    public void replaceRules(SignatureRuleSet rules) {
        this.ruleSet = rules;
        log.info("Signature rules replaced: {} rules from {}", rules.size(), rules.getOrigin());
    }

    public SignatureRuleSet getRuleSet() {
        return ruleSet;
    }

    /**
     * Combines independent confidences so that more matches score higher without exceeding the cap.
     */
    static double combine(List<Double> confidences) {
        double miss = 1.0;
        for (double c : confidences) {
            miss *= 1.0 - c;
        }
        return Math.min(MAX_CONFIDENCE, 1.0 - miss);
    }

    /**
     * Lowercases, URL-decodes up to twice and collapses whitespace.
     */
    static String normalize(String text) {
        String current = decode(text);
        if (current.indexOf('%') >= 0) {
            current = decode(current);
        }
        return WHITESPACE.matcher(current.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    private static String decode(String text) {
        try {
            return URLDecoder.decode(text, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // Malformed escape; evaluate what we have
            return text;
        }
    }

    private static SignatureHit toHit(AttackType type, List<Match> matches) {
        List<Double> confidences = new ArrayList<>(matches.size());
        List<String> ruleIds = new ArrayList<>(matches.size());
        StringBuilder evidence = new StringBuilder();
        for (Match m : matches) {
            confidences.add(m.rule.getConfidence());
            ruleIds.add(m.rule.getId());
            if (evidence.length() > 0) {
                evidence.append("; ");
            }
            evidence.append(m.rule.getId()).append(" in ").append(m.target.getName())
                .append(": ").append(truncate(m.fragment));
        }
        return new SignatureHit(type, combine(confidences), ruleIds, evidence.toString());
    }

    private static Match firstMatch(SignatureRuleSet.CompiledRule rule, Map<RequestTarget, List<String>> texts) {
        for (RequestTarget target : rule.getTargets()) {
            List<String> candidates = texts.get(target);
            if (candidates == null) {
                continue;
            }
            for (String candidate : candidates) {
                Matcher m = rule.getPattern().matcher(candidate);
                if (m.find()) {
                    return new Match(rule, target, m.group());
                }
            }
        }
        return null;
    }

    private static Map<RequestTarget, List<String>> extractTexts(LogRecord record) {
        Map<RequestTarget, List<String>> texts = new LinkedHashMap<>();
        addForms(texts, RequestTarget.PATH, record.getPath());
        addForms(texts, RequestTarget.QUERY, record.getQuery());
        addForms(texts, RequestTarget.REFERRER, record.getReferrer());
        addForms(texts, RequestTarget.USER_AGENT, record.getUserAgent());
        for (String value : record.getExtras().values()) {
            addForms(texts, RequestTarget.EXTRAS, value);
        }
        return texts;
    }

    private static void addForms(Map<RequestTarget, List<String>> texts, RequestTarget target, String value) {
        if (value == null || value.isEmpty() || "-".equals(value)) {
            return;
        }
        List<String> forms = texts.computeIfAbsent(target, k -> new ArrayList<>());
        String normalized = normalize(value);
        forms.add(normalized);
        String raw = value.toLowerCase(Locale.ROOT);
        if (!raw.equals(normalized)) {
            forms.add(raw);
        }
    }

    private static String truncate(String fragment) {
        return fragment.length() <= MAX_EVIDENCE_LENGTH ? fragment : fragment.substring(0, MAX_EVIDENCE_LENGTH) + "...";
    }

    private static final class Match {
        final SignatureRuleSet.CompiledRule rule;
        final RequestTarget target;
        final String fragment;

        Match(SignatureRuleSet.CompiledRule rule, RequestTarget target, String fragment) {
            this.rule = rule;
            this.target = target;
            this.fragment = fragment;
        }
    }
}
