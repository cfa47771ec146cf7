package com.forenx.sentinel.alert;

import com.forenx.sentinel.config.DetectionSettings;
import com.forenx.sentinel.config.DetectionSettingsHolder;
import com.forenx.sentinel.detection.behavior.BehaviorHit;
import com.forenx.sentinel.detection.behavior.BehavioralClassifier;
import com.forenx.sentinel.detection.behavior.DetectionMetrics;
import com.forenx.sentinel.detection.behavior.EndpointTrafficTracker;
import com.forenx.sentinel.detection.signature.SignatureHit;
import com.forenx.sentinel.domain.Alert;
import com.forenx.sentinel.domain.AttackType;
import com.forenx.sentinel.domain.LogRecord;
import com.forenx.sentinel.domain.TestRecords;
import com.forenx.sentinel.live.LiveEvent;
import com.forenx.sentinel.live.LiveEventChannel;
import com.forenx.sentinel.storage.AlertFilter;
import com.forenx.sentinel.storage.InMemoryAlertRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static com.forenx.sentinel.domain.TestRecords.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("AlertEmitter Tests")
class AlertEmitterTest {

    private SimpleMeterRegistry registry;
    private DetectionSettingsHolder settingsHolder;
    private InMemoryAlertRepository repository;
    private LiveEventChannel liveChannel;
    private AlertMetrics metrics;
    private AlertEmitter emitter;
    private final AtomicLong clock = new AtomicLong();

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        settingsHolder = new DetectionSettingsHolder(DetectionSettings.defaults());
        repository = new InMemoryAlertRepository();
        liveChannel = new LiveEventChannel(64, registry);
        metrics = new AlertMetrics(registry);
        emitter = new AlertEmitter(settingsHolder, repository, liveChannel, metrics, clock::get);
    }

    private static LogRecord record(Instant ts, long offset) {
        return TestRecords.at(ts, "203.0.113.5", "/login", 401, offset);
    }

    private static BehaviorHit bruteForce(double confidence) {
        return new BehaviorHit(AttackType.BRUTE_FORCE, "203.0.113.5", "/login", confidence, 11, 10, "auth failures");
    }

    private List<Alert> allAlerts() {
        return repository.find(AlertFilter.range(T0.minus(Duration.ofDays(1)), T0.plus(Duration.ofDays(1))), 100);
    }

    @Test
    @DisplayName("Should fold triggers within the coalescing interval into one alert with max confidence")
    void shouldCoalesceWithinInterval() {
        emitter.emit(List.of(), List.of(bruteForce(0.76)), record(T0, 0));
        emitter.emit(List.of(), List.of(bruteForce(0.94)), record(T0.plusSeconds(20), 1));
        emitter.emit(List.of(), List.of(bruteForce(0.82)), record(T0.plusSeconds(40), 2));

        List<Alert> alerts = allAlerts();
        assertThat(alerts).hasSize(1);
        Alert alert = alerts.get(0);
        assertThat(alert.getConfidence()).isEqualTo(0.94);
        assertThat(alert.getTimestamp()).isEqualTo(T0);
        assertThat(alert.getTriggerCount()).isEqualTo(3);
        assertThat(alert.getSourceRecordIds()).containsExactly("test.log:0", "test.log:1", "test.log:2");
        assertThat(metrics.getRaisedCount(AttackType.BRUTE_FORCE)).isEqualTo(1.0);
        assertThat(metrics.getCoalescedCount()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should open a new alert once the coalescing interval has passed")
    void shouldRaiseAgainAfterInterval() {
        emitter.emit(List.of(), List.of(bruteForce(0.8)), record(T0, 0));
        emitter.emit(List.of(), List.of(bruteForce(0.8)), record(T0.plusSeconds(61), 1));

        assertThat(allAlerts()).hasSize(2);
        assertThat(allAlerts()).extracting(Alert::getId).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("Should keep identities apart by type, client and endpoint")
    void shouldSeparateIdentities() {
        LogRecord r = record(T0, 0);
        emitter.emit(List.of(new SignatureHit(AttackType.SQL_INJECTION, 0.8, List.of("sqli"), "e")),
            List.of(bruteForce(0.8),
                new BehaviorHit(AttackType.BRUTE_FORCE, "203.0.113.5", "/admin", 0.8, 11, 10, "e")), r);

        assertThat(allAlerts()).hasSize(3);
    }

    @Test
    @DisplayName("Should derive the alert id from identity and first trigger time")
    void shouldUseDeterministicIds() {
        Alert first = emitter.emit(List.of(), List.of(bruteForce(0.8)), record(T0, 0)).get(0);

        AlertEmitter other = new AlertEmitter(settingsHolder, new InMemoryAlertRepository(), liveChannel, metrics);
        Alert replayed = other.emit(List.of(), List.of(bruteForce(0.8)), record(T0, 0)).get(0);

        assertThat(replayed.getId()).isEqualTo(first.getId()).hasSize(64);
    }

    @Test
    @DisplayName("Should raise signature confidence when behavior corroborates the same record")
    void shouldApplyCorroborationBonus() {
        SignatureHit sqli = new SignatureHit(AttackType.SQL_INJECTION, 0.8, List.of("sqli"), "e");

        Alert alone = emitter.emit(List.of(sqli), List.of(), TestRecords.at(T0, "10.0.0.1", "/a", 200, 0)).get(0);
        Alert corroborated = emitter.emit(List.of(sqli), List.of(bruteForce(0.8)),
            TestRecords.at(T0, "10.0.0.2", "/a", 200, 1)).get(0);

        assertThat(alone.getConfidence()).isEqualTo(0.8);
        assertThat(corroborated.getConfidence()).isCloseTo(0.85, within(1e-9));
    }

    @Test
    @DisplayName("Should publish only newly raised alerts to live subscribers")
    void shouldPublishOnlyNewAlerts() {
        Flux<LiveEvent> events = liveChannel.subscribe();

        StepVerifier.create(events)
            .then(() -> {
                emitter.emit(List.of(), List.of(bruteForce(0.8)), record(T0, 0));
                emitter.emit(List.of(), List.of(bruteForce(0.9)), record(T0.plusSeconds(5), 1));
                liveChannel.complete();
            })
            .assertNext(e -> assertThat(e.getType()).isEqualTo(LiveEvent.Type.ALERT_RAISED))
            .verifyComplete();
    }

    @Test
    @DisplayName("Should forget bursts that saw no trigger for the eviction TTL by wall clock")
    void shouldEvictIdleBursts() {
        emitter.emit(List.of(), List.of(bruteForce(0.8)), record(T0, 0));
        clock.set(Duration.ofMinutes(5).toNanos());
        emitter.emit(List.of(), List.of(new BehaviorHit(AttackType.DOS, "203.0.113.5", BehaviorHit.ANY, 0.8,
            400, 300, "rate")), record(T0.plusSeconds(120), 1));

        assertThat(emitter.openBursts()).isEqualTo(2);
        assertThat(emitter.evictExpired()).isZero();

        clock.set(settingsHolder.get().getEvictionTtl().plusSeconds(1).toNanos());

        assertThat(emitter.evictExpired()).isEqualTo(1);
        assertThat(emitter.openBursts()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep coalescing a replayed burst after another source raised a much newer alert")
    void shouldCoalesceAcrossSourcesWithDifferentEventTimes() {
        Instant replayed = Instant.parse("2023-01-01T00:00:00Z");
        emitter.emit(List.of(), List.of(bruteForce(0.8)), record(replayed, 0));
        emitter.emit(List.of(), List.of(new BehaviorHit(AttackType.DOS, "192.0.2.44", BehaviorHit.ANY, 0.8,
            400, 300, "rate")), TestRecords.at(T0.plus(Duration.ofDays(400)), "192.0.2.44", "/", 200, 1));

        emitter.evictExpired();
        emitter.emit(List.of(), List.of(bruteForce(0.9)), record(replayed.plusSeconds(10), 2));

        List<Alert> alerts = repository.find(AlertFilter.range(replayed.minus(Duration.ofDays(1)),
            T0.plus(Duration.ofDays(401))), 100);
        assertThat(alerts).hasSize(2);
        assertThat(alerts).filteredOn(a -> a.getAttackType() == AttackType.BRUTE_FORCE)
            .singleElement()
            .satisfies(a -> assertThat(a.getTriggerCount()).isEqualTo(2));
    }

    @Test
    @DisplayName("Should raise exactly one brute force alert for a 15 second credential attack")
    void shouldRaiseOneAlertForBruteForceScenario() {
        BehavioralClassifier classifier = new BehavioralClassifier(settingsHolder, new EndpointTrafficTracker(),
            new DetectionMetrics(registry));

        for (int i = 0; i < 15; i++) {
            LogRecord r = record(T0.plusSeconds(i), i);
            emitter.emit(List.of(), classifier.observe(r), r);
        }

        List<Alert> alerts = allAlerts();
        assertThat(alerts).hasSize(1);
        assertThat(alerts.get(0).getAttackType()).isEqualTo(AttackType.BRUTE_FORCE);
        assertThat(alerts.get(0).getConfidence()).isGreaterThanOrEqualTo(0.9);
        assertThat(alerts.get(0).getTriggerCount()).isEqualTo(5);
        assertThat(alerts.get(0).getSourceRecordIds()).first().isEqualTo("test.log:10");
    }
}
