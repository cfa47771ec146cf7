package com.forenx.sentinel.storage;

import com.forenx.sentinel.domain.Alert;
import com.forenx.sentinel.domain.AttackType;

import java.time.Instant;

/**
 * Range and field filter for alert queries. Null fields do not filter; range is {@code [from, to)}.
 */
public final class AlertFilter {

    private final Instant from;
    private final Instant to;
    private final AttackType attackType;
    private final String clientIp;
    private final Double minConfidence;

    public AlertFilter(Instant from, Instant to, AttackType attackType, String clientIp, Double minConfidence) {
        this.from = from;
        this.to = to;
        this.attackType = attackType;
        this.clientIp = clientIp;
        this.minConfidence = minConfidence;
    }

    public static AlertFilter range(Instant from, Instant to) {
        return new AlertFilter(from, to, null, null, null);
    }

    public boolean matches(Alert alert) {
        Instant ts = alert.getTimestamp();
        if (ts.isBefore(from) || !ts.isBefore(to)) {
            return false;
        }
        if (attackType != null && attackType != alert.getAttackType()) {
            return false;
        }
        if (clientIp != null && !clientIp.equals(alert.getClientIp())) {
            return false;
        }
        return minConfidence == null || alert.getConfidence() >= minConfidence;
    }

    public Instant getFrom() {
        return from;
    }

    public Instant getTo() {
        return to;
    }
}
