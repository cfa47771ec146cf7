package com.forenx.sentinel.detection.behavior;

import com.forenx.sentinel.config.DetectionSettings;
import com.forenx.sentinel.config.DetectionSettingsHolder;
import com.forenx.sentinel.domain.AttackType;
import com.forenx.sentinel.domain.LogRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Stateful windowed classifier for brute force, denial of service and data exfiltration.
 *
 * One instance belongs to one behavior shard and sees every record of the client addresses
 * hashed to it, in order, from a single thread. Per address it keeps three windows (auth
 * failures, request rate, transferred volume) and one auth window per address/endpoint pair.
 * Endpoint-wide state is shared through {@link EndpointTrafficTracker}.
 *
 * Thresholds are read from the current {@link DetectionSettings} on every record. When a
 * reload changes a window length, the affected windows restart empty.
 */
public class BehavioralClassifier {

    private static final Logger log = LoggerFactory.getLogger(BehavioralClassifier.class);

    private final DetectionSettingsHolder settingsHolder;
    private final EndpointTrafficTracker endpointTracker;
    private final DetectionMetrics metrics;
    private final LongSupplier nanoClock;

    private final Map<String, ClientState> clients = new HashMap<>();
    private final Map<String, ClassifierWindow> pairs = new HashMap<>();

    public BehavioralClassifier(DetectionSettingsHolder settingsHolder, EndpointTrafficTracker endpointTracker,
                                DetectionMetrics metrics) {
        this(settingsHolder, endpointTracker, metrics, System::nanoTime);
    }

    BehavioralClassifier(DetectionSettingsHolder settingsHolder, EndpointTrafficTracker endpointTracker,
                         DetectionMetrics metrics, LongSupplier nanoClock) {
        this.settingsHolder = settingsHolder;
        this.endpointTracker = endpointTracker;
        this.metrics = metrics;
        this.nanoClock = nanoClock;
    }

    public List<BehaviorHit> observe(LogRecord record) {
        DetectionSettings s = settingsHolder.get();
        long now = nanoClock.getAsLong();
        String ip = record.getClientIp();
        String endpoint = endpointOf(record);
        Instant ts = record.getTimestamp();
        int status = record.getStatusCode();
        long bytes = record.getBytesSent();

        ClientState client = clients.computeIfAbsent(ip, k -> new ClientState());
        client.auth = fit(client.auth, ip, s.getAuthWindow(), s);
        client.rate = fit(client.rate, ip, s.getRateWindow(), s);
        client.volume = fit(client.volume, ip, s.getVolumeWindow(), s);
        String pairKey = ip + "|" + endpoint;
        ClassifierWindow pair = fit(pairs.get(pairKey), pairKey, s.getAuthWindow(), s);
        pairs.put(pairKey, pair);

        boolean authAccepted = client.auth.observe(ts, status, bytes, endpoint);
        boolean rateAccepted = client.rate.observe(ts, status, bytes, endpoint);
        boolean volumeAccepted = client.volume.observe(ts, status, bytes, endpoint);
        pair.observe(ts, status, bytes, endpoint);
        client.auth.touch(now);
        client.rate.touch(now);
        client.volume.touch(now);
        pair.touch(now);
        if (!authAccepted || !rateAccepted || !volumeAccepted) {
            metrics.recordLateEvent();
        }

        List<BehaviorHit> hits = new ArrayList<>(2);

        boolean authFailure = status == 401 || status == 403;
        if (authAccepted && authFailure && client.auth.getAuthFailureCount() > s.getAuthThreshold()) {
            long failures = client.auth.getAuthFailureCount();
            hits.add(new BehaviorHit(AttackType.BRUTE_FORCE, ip, endpoint,
                ThresholdScore.score(failures, s.getAuthThreshold(), s), failures, s.getAuthThreshold(),
                String.format("%d auth failures (401/403) within %s, %d on %s, threshold %d",
                    failures, describe(s.getAuthWindow()), pair.getAuthFailureCount(), endpoint,
                    s.getAuthThreshold())));
        }

        if (rateAccepted && client.rate.getEventCount() > s.getRateThreshold() && !isBruteForceShaped(client.rate, s)) {
            long events = client.rate.getEventCount();
            hits.add(new BehaviorHit(AttackType.DOS, ip, BehaviorHit.ANY,
                ThresholdScore.score(events, s.getRateThreshold(), s), events, s.getRateThreshold(),
                String.format("%d requests within %s across %d endpoints, threshold %d",
                    events, describe(s.getRateWindow()), client.rate.getDistinctEndpoints(), s.getRateThreshold())));
        }

        EndpointTrafficTracker.Observation endpointState = endpointTracker.observe(record, endpoint, s, now);
        if (endpointState.isAccepted() && endpointState.getWindowEvents() > s.getEndpointRateThreshold()) {
            long events = endpointState.getWindowEvents();
            hits.add(new BehaviorHit(AttackType.DOS, BehaviorHit.ANY, endpoint,
                ThresholdScore.score(events, s.getEndpointRateThreshold(), s), events, s.getEndpointRateThreshold(),
                String.format("%d requests to %s from all clients within %s, threshold %d",
                    events, endpoint, describe(s.getRateWindow()), s.getEndpointRateThreshold())));
        }

        if (volumeAccepted && client.volume.getBytesTotal() > s.getBytesThreshold()) {
            long total = client.volume.getBytesTotal();
            hits.add(new BehaviorHit(AttackType.DATA_EXFILTRATION, ip, BehaviorHit.ANY,
                ThresholdScore.score(total, s.getBytesThreshold(), s), total, s.getBytesThreshold(),
                String.format("%d bytes sent within %s, threshold %d",
                    total, describe(s.getVolumeWindow()), s.getBytesThreshold())));
        }
        if (endpointState.isOutlier()) {
            long threshold = (long) Math.ceil(endpointState.getOutlierThreshold());
            hits.add(new BehaviorHit(AttackType.DATA_EXFILTRATION, ip, endpoint,
                ThresholdScore.score(bytes, threshold, s), bytes, threshold,
                String.format("single response of %d bytes on %s, baseline mean %.0f, outlier threshold %d",
                    bytes, endpoint, endpointState.getBaselineMean(), threshold)));
        }

        for (BehaviorHit hit : hits) {
            metrics.recordHit(hit.getAttackType());
        }
        if (!hits.isEmpty() && log.isDebugEnabled()) {
            log.debug("Record {} produced {}", record.getId(), hits);
        }
        return hits;
    }

    /**
     * Low endpoint diversity with mostly failed authentications is a credential attack, not a flood.
     */
    private static boolean isBruteForceShaped(ClassifierWindow rate, DetectionSettings s) {
        return rate.getDistinctEndpoints() < s.getDiversityThreshold()
            && rate.getAuthFailureCount() * 2 >= rate.getEventCount();
    }

    /**
     * Purges windows that received no event for the eviction TTL of wall-clock time. Event
     * time never expires a window, so sources replaying different periods can share a shard.
     * Must run on the thread that owns this classifier.
     *
     * @return number of keys removed
     */
    public int evictIdle() {
        long cutoffNanos = nanoClock.getAsLong() - settingsHolder.get().getEvictionTtl().toNanos();

        int before = clients.size() + pairs.size();
        clients.values().removeIf(c -> c.isIdle(cutoffNanos));
        pairs.values().removeIf(w -> w.isIdle(cutoffNanos));
        int removed = before - clients.size() - pairs.size();
        if (removed > 0) {
            metrics.recordEvicted(removed);
            log.debug("Evicted {} idle classifier keys, {} remain", removed, clients.size() + pairs.size());
        }
        return removed;
    }

    public int trackedClients() {
        return clients.size();
    }

    public int trackedPairs() {
        return pairs.size();
    }

    ClassifierWindow authWindow(String ip) {
        ClientState state = clients.get(ip);
        return state == null ? null : state.auth;
    }

    private static ClassifierWindow fit(ClassifierWindow window, String key, Duration length, DetectionSettings s) {
        if (window == null || !window.getLength().equals(length)) {
            return new ClassifierWindow(key, length, s.getMaxTrackedEndpoints());
        }
        return window;
    }

    static String endpointOf(LogRecord record) {
        String path = record.getPath();
        return path == null || path.isEmpty() ? "/" : path;
    }

    private static String describe(Duration d) {
        return d.toString().substring(2).toLowerCase(Locale.ROOT);
    }

    private static final class ClientState {
        ClassifierWindow auth;
        ClassifierWindow rate;
        ClassifierWindow volume;

        boolean isIdle(long cutoffNanos) {
            return auth.isIdle(cutoffNanos) && rate.isIdle(cutoffNanos) && volume.isIdle(cutoffNanos);
        }
    }
}
