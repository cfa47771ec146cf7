package com.forenx.sentinel.storage;

import com.forenx.sentinel.domain.Alert;
import com.forenx.sentinel.domain.AttackType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.forenx.sentinel.domain.TestRecords.T0;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InMemoryAlertRepository Tests")
class InMemoryAlertRepositoryTest {

    private static final Instant FROM = T0.minus(Duration.ofHours(1));
    private static final Instant TO = T0.plus(Duration.ofHours(1));

    private InMemoryAlertRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryAlertRepository();
        repository.save(alert("a1", T0, AttackType.BRUTE_FORCE, "10.0.0.1", 0.8));
        repository.save(alert("a2", T0.plusSeconds(10), AttackType.SQL_INJECTION, "10.0.0.2", 0.95));
        repository.save(alert("a3", T0.plusSeconds(20), AttackType.DOS, "10.0.0.1", 0.7));
    }

    private static Alert alert(String id, Instant ts, AttackType type, String ip, double confidence) {
        return new Alert(id, ts, type, ip, "/login", confidence, "evidence", List.of("test.log:0"), 1);
    }

    @Test
    @DisplayName("Should return newest alerts first")
    void shouldOrderNewestFirst() {
        List<Alert> alerts = repository.find(AlertFilter.range(FROM, TO), 10);

        assertThat(alerts).extracting(Alert::getId).containsExactly("a3", "a2", "a1");
    }

    @Test
    @DisplayName("Should apply type, client and confidence filters")
    void shouldFilter() {
        assertThat(repository.find(new AlertFilter(FROM, TO, AttackType.DOS, null, null), 10))
            .extracting(Alert::getId).containsExactly("a3");
        assertThat(repository.find(new AlertFilter(FROM, TO, null, "10.0.0.1", null), 10))
            .extracting(Alert::getId).containsExactly("a3", "a1");
        assertThat(repository.find(new AlertFilter(FROM, TO, null, null, 0.8), 10))
            .extracting(Alert::getId).containsExactly("a2", "a1");
    }

    @Test
    @DisplayName("Should honor the limit")
    void shouldLimit() {
        assertThat(repository.find(AlertFilter.range(FROM, TO), 1)).extracting(Alert::getId).containsExactly("a3");
    }

    @Test
    @DisplayName("Should replace an alert saved again under the same id")
    void shouldUpsertById() {
        Alert merged = repository.findById("a1").orElseThrow()
            .mergeWith(0.9, "more", List.of("test.log:1"), 50);

        repository.save(merged);

        assertThat(repository.count()).isEqualTo(3L);
        assertThat(repository.find(AlertFilter.range(FROM, TO), 10)).hasSize(3);
        assertThat(repository.findById("a1").orElseThrow().getConfidence()).isEqualTo(0.9);
    }
}
