package com.forenx.sentinel.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TimeRange Tests")
class TimeRangeTest {

    @Test
    @DisplayName("Should accept ISO instants, offset date-times and epoch millis")
    void shouldParseBoundNotations() {
        TimeRange range = TimeRange.parse("2024-03-04T09:00:00Z", "2024-03-04T12:00:00+02:00");

        assertThat(range.getFrom()).isEqualTo(Instant.parse("2024-03-04T09:00:00Z"));
        assertThat(range.getTo()).isEqualTo(Instant.parse("2024-03-04T10:00:00Z"));
        assertThat(range.length()).isEqualTo(Duration.ofHours(1));
        assertThat(TimeRange.parse("0", "1709542800000").getTo()).isEqualTo(Instant.parse("2024-03-04T09:00:00Z"));
    }

    @Test
    @DisplayName("Should accept an empty range")
    void shouldAcceptEmptyRange() {
        TimeRange range = TimeRange.parse("1000", "1000");

        assertThat(range.length()).isZero();
    }

    @Test
    @DisplayName("Should reject an inverted range naming the offending parameter")
    void shouldRejectInvertedRange() {
        assertThatThrownBy(() -> TimeRange.parse("2024-03-04T10:00:00Z", "2024-03-04T09:00:00Z"))
            .isInstanceOf(QueryValidationException.class)
            .extracting(e -> ((QueryValidationException) e).getParameter())
            .isEqualTo("to");
    }

    @Test
    @DisplayName("Should reject missing and malformed bounds")
    void shouldRejectBadBounds() {
        assertThatThrownBy(() -> TimeRange.parse(null, "1000"))
            .isInstanceOf(QueryValidationException.class)
            .hasMessageContaining("from");
        assertThatThrownBy(() -> TimeRange.parse("1000", "yesterday"))
            .isInstanceOf(QueryValidationException.class)
            .hasMessageContaining("not a timestamp");
        assertThatThrownBy(() -> TimeRange.parse("99999999999999999999", "1000"))
            .isInstanceOf(QueryValidationException.class)
            .hasMessageContaining("out of range");
    }
}
