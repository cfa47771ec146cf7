package com.forenx.sentinel.analytics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Granularity Tests")
class GranularityTest {

    private static final Instant T = Instant.parse("2024-03-06T13:45:10Z");

    @Test
    @DisplayName("Should align bucket starts in UTC")
    void shouldAlignBuckets() {
        assertThat(Granularity.HOUR.bucketStart(T)).isEqualTo(Instant.parse("2024-03-06T13:00:00Z"));
        assertThat(Granularity.DAY.bucketStart(T)).isEqualTo(Instant.parse("2024-03-06T00:00:00Z"));
        assertThat(Granularity.WEEK.bucketStart(T)).isEqualTo(Instant.parse("2024-03-04T00:00:00Z"));
        assertThat(Granularity.MONTH.bucketStart(T)).isEqualTo(Instant.parse("2024-03-01T00:00:00Z"));
    }

    @Test
    @DisplayName("Should step months by calendar length")
    void shouldStepMonths() {
        assertThat(Granularity.MONTH.next(Instant.parse("2024-02-01T00:00:00Z")))
            .isEqualTo(Instant.parse("2024-03-01T00:00:00Z"));
    }

    @Test
    @DisplayName("Should parse wire values case-insensitively")
    void shouldParseValues() {
        assertThat(Granularity.fromValue("Day")).isEqualTo(Granularity.DAY);
        assertThatThrownBy(() -> Granularity.fromValue("minute")).isInstanceOf(IllegalArgumentException.class);
    }
}
