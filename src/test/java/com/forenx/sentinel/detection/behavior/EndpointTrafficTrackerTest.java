package com.forenx.sentinel.detection.behavior;

import com.forenx.sentinel.config.DetectionSettings;
import com.forenx.sentinel.domain.TestRecords;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static com.forenx.sentinel.domain.TestRecords.T0;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EndpointTrafficTracker Tests")
class EndpointTrafficTrackerTest {

    private final DetectionSettings settings = DetectionSettings.defaults();
    private final EndpointTrafficTracker tracker = new EndpointTrafficTracker();

    @Test
    @DisplayName("Should evict endpoints by wall-clock idleness regardless of event time")
    void shouldEvictByWallClockOnly() {
        long ttl = settings.getEvictionTtl().toNanos();
        tracker.observe(TestRecords.at(Instant.parse("2023-01-01T00:00:00Z"), "10.0.0.1", "/old", 200, 0),
            "/old", settings, 0L);
        tracker.observe(TestRecords.at(T0.plus(Duration.ofDays(400)), "10.0.0.2", "/new", 200, 1),
            "/new", settings, ttl);

        assertThat(tracker.evictIdle(0L)).isZero();
        assertThat(tracker.evictIdle(1L)).isEqualTo(1);
        assertThat(tracker.trackedEndpoints()).isEqualTo(1L);
    }
}
