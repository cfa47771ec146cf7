package com.forenx.sentinel.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DetectionSettingsHolder Tests")
class DetectionSettingsHolderTest {

    private DetectionSettingsHolder holder;

    @BeforeEach
    void setUp() {
        holder = new DetectionSettingsHolder(new SentinelProperties());
    }

    @Test
    @DisplayName("Should start from the documented defaults")
    void shouldExposeDefaults() {
        DetectionSettings s = holder.get();

        assertThat(s.getAuthThreshold()).isEqualTo(10);
        assertThat(s.getAuthWindow()).isEqualTo(Duration.ofMinutes(5));
        assertThat(s.getRateThreshold()).isEqualTo(300);
        assertThat(s.getRateWindow()).isEqualTo(Duration.ofMinutes(1));
        assertThat(s.getBytesThreshold()).isEqualTo(10_000_000L);
        assertThat(s.getVolumeWindow()).isEqualTo(Duration.ofHours(1));
        assertThat(s.getCoalescingInterval()).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    @DisplayName("Should apply a partial update and keep unspecified fields")
    void shouldApplyPartialUpdate() {
        DetectionSettingsUpdate update = new DetectionSettingsUpdate();
        update.setAuthThreshold(5);
        update.setAuthWindow(Duration.ofMinutes(2));

        DetectionSettings applied = holder.apply(update);

        assertThat(holder.get()).isSameAs(applied);
        assertThat(applied.getAuthThreshold()).isEqualTo(5);
        assertThat(applied.getAuthWindow()).isEqualTo(Duration.ofMinutes(2));
        assertThat(applied.getRateThreshold()).isEqualTo(300);
    }

    @Test
    @DisplayName("Should reject a non-positive threshold and keep the active settings")
    void shouldRejectInvalidThreshold() {
        DetectionSettings before = holder.get();
        DetectionSettingsUpdate update = new DetectionSettingsUpdate();
        update.setRateThreshold(0);

        assertThatThrownBy(() -> holder.apply(update))
            .isInstanceOf(ClassifierConfigException.class)
            .extracting(e -> ((ClassifierConfigException) e).getDefinition())
            .isEqualTo("rate_threshold");
        assertThat(holder.get()).isSameAs(before);
    }

    @Test
    @DisplayName("Should reject an eviction TTL shorter than the longest window")
    void shouldRejectShortEvictionTtl() {
        DetectionSettingsUpdate update = new DetectionSettingsUpdate();
        update.setEvictionTtl(Duration.ofMinutes(30));

        assertThatThrownBy(() -> holder.apply(update))
            .isInstanceOf(ClassifierConfigException.class)
            .hasMessageContaining("eviction_ttl");
    }

    @Test
    @DisplayName("Should reject a zero-length window")
    void shouldRejectZeroWindow() {
        DetectionSettings invalid = holder.get().toBuilder().volumeWindow(Duration.ZERO).build();

        assertThatThrownBy(() -> holder.update(invalid)).isInstanceOf(ClassifierConfigException.class);
    }
}
