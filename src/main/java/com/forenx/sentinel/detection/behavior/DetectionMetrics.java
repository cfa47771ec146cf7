package com.forenx.sentinel.detection.behavior;

import com.forenx.sentinel.domain.AttackType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Counters for both classifiers: hits per attack type, late events and idle evictions.
 */
@Component
public class DetectionMetrics {

    private final Map<AttackType, Counter> hits = new EnumMap<>(AttackType.class);
    private final Counter lateEvents;
    private final Counter evictedKeys;

    public DetectionMetrics(MeterRegistry registry) {
        for (AttackType type : AttackType.values()) {
            hits.put(type, Counter.builder("forenx.detection.hits")
                .description("Classifier hits by attack type")
                .tag("attack_type", type.getValue())
                .tag("source", type.getSource().name().toLowerCase(Locale.ROOT))
                .register(registry));
        }
        this.lateEvents = Counter.builder("forenx.detection.late.events")
            .description("Events older than the behavioral window they belong to")
            .register(registry);
        this.evictedKeys = Counter.builder("forenx.detection.evicted.keys")
            .description("Idle classifier windows purged by the sweep")
            .register(registry);
    }

    public void recordHit(AttackType type) {
        hits.get(type).increment();
    }

    public void recordLateEvent() {
        lateEvents.increment();
    }

    public void recordEvicted(int count) {
        evictedKeys.increment(count);
    }

    public double getHitCount(AttackType type) {
        return hits.get(type).count();
    }

    public double getLateEventCount() {
        return lateEvents.count();
    }
}
