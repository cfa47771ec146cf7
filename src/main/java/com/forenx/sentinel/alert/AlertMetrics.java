package com.forenx.sentinel.alert;

import com.forenx.sentinel.domain.AttackType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

@Component
public class AlertMetrics {

    private final Map<AttackType, Counter> raised = new EnumMap<>(AttackType.class);
    private final Counter coalesced;

    public AlertMetrics(MeterRegistry registry) {
        for (AttackType type : AttackType.values()) {
            raised.put(type, Counter.builder("forenx.alerts.raised")
                .description("New alerts by attack type")
                .tag("attack_type", type.getValue())
                .register(registry));
        }
        this.coalesced = Counter.builder("forenx.alerts.coalesced")
            .description("Triggers merged into an existing alert inside the coalescing interval")
            .register(registry);
    }

    public void recordRaised(AttackType type) {
        raised.get(type).increment();
    }

    public void recordCoalesced() {
        coalesced.increment();
    }

    public double getRaisedCount(AttackType type) {
        return raised.get(type).count();
    }

    public double getCoalescedCount() {
        return coalesced.count();
    }
}
