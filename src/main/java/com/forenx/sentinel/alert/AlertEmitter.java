package com.forenx.sentinel.alert;

import com.forenx.sentinel.config.DetectionSettings;
import com.forenx.sentinel.config.DetectionSettingsHolder;
import com.forenx.sentinel.detection.behavior.BehaviorHit;
import com.forenx.sentinel.detection.signature.SignatureHit;
import com.forenx.sentinel.domain.Alert;
import com.forenx.sentinel.domain.AttackType;
import com.forenx.sentinel.domain.LogRecord;
import com.forenx.sentinel.live.LiveEvent;
import com.forenx.sentinel.live.LiveEventChannel;
import com.forenx.sentinel.storage.AlertRepository;
import com.google.common.hash.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Turns classifier hits into persisted alerts, coalescing repeats.
 *
 * Triggers with the same (attack type, client, endpoint) whose event times lie within the
 * coalescing interval of the first trigger are folded into that first alert: its id and
 * timestamp stay, confidence rises to the maximum seen and the source records accumulate.
 * The merged alert is upserted by id, so the store holds one alert per coalesced burst.
 * Only the first trigger of a burst is published to live subscribers.
 *
 * Hits arrive from all behavior shards. Each identity is updated under its own map-entry
 * lock, so shards only contend when they raise the same alert. An identity's coalescing
 * state is dropped once it saw no trigger for the coalescing interval or the eviction TTL,
 * whichever is longer, of wall-clock time.
 */
@Service
public class AlertEmitter {

    private static final Logger log = LoggerFactory.getLogger(AlertEmitter.class);

    private final DetectionSettingsHolder settingsHolder;
    private final AlertRepository repository;
    private final LiveEventChannel liveChannel;
    private final AlertMetrics metrics;

    private final LongSupplier nanoClock;

    private final ConcurrentHashMap<AlertKey, OpenBurst> open = new ConcurrentHashMap<>();

    @Autowired
    public AlertEmitter(DetectionSettingsHolder settingsHolder, AlertRepository repository,
                        LiveEventChannel liveChannel, AlertMetrics metrics) {
        this(settingsHolder, repository, liveChannel, metrics, System::nanoTime);
    }

    AlertEmitter(DetectionSettingsHolder settingsHolder, AlertRepository repository,
                 LiveEventChannel liveChannel, AlertMetrics metrics, LongSupplier nanoClock) {
        this.settingsHolder = settingsHolder;
        this.repository = repository;
        this.liveChannel = liveChannel;
        this.metrics = metrics;
        this.nanoClock = nanoClock;
    }

    /**
     * @return alerts created or updated by this record, in hit order
     * @throws com.forenx.sentinel.storage.StorageWriteException if an alert could not be persisted
     */
    public List<Alert> emit(List<SignatureHit> signatureHits, List<BehaviorHit> behaviorHits, LogRecord record) {
        if (signatureHits.isEmpty() && behaviorHits.isEmpty()) {
            return List.of();
        }
        DetectionSettings s = settingsHolder.get();

        List<Alert> result = new ArrayList<>(signatureHits.size() + behaviorHits.size());
        boolean corroborated = !behaviorHits.isEmpty();
        String endpoint = record.getPath().isEmpty() ? "/" : record.getPath();
        for (SignatureHit hit : signatureHits) {
            double confidence = hit.getConfidence();
            if (corroborated) {
                confidence = Math.min(1.0, confidence + s.getCorroborationBonus());
            }
            result.add(raise(new AlertKey(hit.getAttackType(), record.getClientIp(), endpoint),
                confidence, hit.getEvidence(), record, s));
        }
        for (BehaviorHit hit : behaviorHits) {
            result.add(raise(new AlertKey(hit.getAttackType(), hit.getClientIp(), hit.getEndpoint()),
                hit.getConfidence(), hit.getEvidence(), record, s));
        }
        return result;
    }

    private Alert raise(AlertKey key, double confidence, String evidence, LogRecord record, DetectionSettings s) {
        long intervalMillis = s.getCoalescingInterval().toMillis();
        Instant ts = record.getTimestamp();
        List<String> recordIds = List.of(record.getId());
        long now = nanoClock.getAsLong();
        Alert[] produced = new Alert[1];
        boolean[] created = new boolean[1];

        open.compute(key, (k, existing) -> {
            if (existing != null
                    && Math.abs(ts.toEpochMilli() - existing.alert.getTimestamp().toEpochMilli()) < intervalMillis) {
                produced[0] = existing.alert.mergeWith(confidence, evidence, recordIds, s.getMaxSourceRecords());
                repository.save(produced[0]);
                return new OpenBurst(produced[0], now);
            }
            produced[0] = new Alert(alertId(k, ts), ts, k.type, k.clientIp, k.endpoint,
                confidence, evidence, recordIds, 1);
            created[0] = true;
            repository.save(produced[0]);
            // A late trigger from an older burst does not displace the open one
            if (existing != null && existing.alert.getTimestamp().isAfter(ts)) {
                return new OpenBurst(existing.alert, now);
            }
            return new OpenBurst(produced[0], now);
        });

        Alert alert = produced[0];
        if (created[0]) {
            metrics.recordRaised(key.type);
            log.info("Alert raised: {} client={} endpoint={} confidence={} ({})",
                key.type.getValue(), key.clientIp, key.endpoint, String.format("%.2f", confidence), evidence);
            liveChannel.publish(LiveEvent.alertRaised(alert));
        } else {
            metrics.recordCoalesced();
        }
        return alert;
    }

    /**
     * Forgets coalescing state for identities without a trigger for the retention period of
     * wall-clock time. Event time is not consulted.
     *
     * @return number of entries removed
     */
    public int evictExpired() {
        DetectionSettings s = settingsHolder.get();
        Duration retention = s.getCoalescingInterval().compareTo(s.getEvictionTtl()) > 0
            ? s.getCoalescingInterval() : s.getEvictionTtl();
        long cutoffNanos = nanoClock.getAsLong() - retention.toNanos();
        int before = open.size();
        open.values().removeIf(burst -> burst.lastTriggerNanos - cutoffNanos < 0);
        return before - open.size();
    }

    public int openBursts() {
        return open.size();
    }

    static String alertId(AlertKey key, Instant firstTrigger) {
        return Hashing.sha256()
            .hashString(key.type.getValue() + "|" + key.clientIp + "|" + key.endpoint + "|"
                + firstTrigger.toEpochMilli(), StandardCharsets.UTF_8)
            .toString();
    }

    private static final class OpenBurst {
        final Alert alert;
        final long lastTriggerNanos;

        OpenBurst(Alert alert, long lastTriggerNanos) {
            this.alert = alert;
            this.lastTriggerNanos = lastTriggerNanos;
        }
    }

    static final class AlertKey {
        final AttackType type;
        final String clientIp;
        final String endpoint;

        AlertKey(AttackType type, String clientIp, String endpoint) {
            this.type = type;
            this.clientIp = clientIp;
            this.endpoint = endpoint;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof AlertKey)) {
                return false;
            }
            AlertKey that = (AlertKey) o;
            return type == that.type && Objects.equals(clientIp, that.clientIp) && Objects.equals(endpoint, that.endpoint);
        }

        @Override
        public int hashCode() {
            return Objects.hash(type, clientIp, endpoint);
        }
    }
}
