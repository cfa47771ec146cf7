package com.forenx.sentinel.storage;

import com.forenx.sentinel.domain.LogRecord;
import com.forenx.sentinel.domain.TestRecords;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static com.forenx.sentinel.domain.TestRecords.T0;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InMemoryRecordStore Tests")
class InMemoryRecordStoreTest {

    private static final Instant FROM = T0.minus(Duration.ofHours(1));
    private static final Instant TO = T0.plus(Duration.ofHours(1));

    private InMemoryRecordStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecordStore();
        for (int i = 0; i < 25; i++) {
            int status = i % 5 == 0 ? 404 : 200;
            String ip = i % 2 == 0 ? "10.0.0.1" : "10.0.0.2";
            store.append(TestRecords.at(T0.plusSeconds(i), ip, "/api/item/" + i, status, i));
        }
    }

    @Test
    @DisplayName("Should page records in timestamp order with the total match count")
    void shouldPageInOrder() {
        Page<LogRecord> first = store.find(RecordFilter.builder(FROM, TO).build(), 0, 10);
        Page<LogRecord> last = store.find(RecordFilter.builder(FROM, TO).build(), 20, 10);

        assertThat(first.getItems()).hasSize(10);
        assertThat(first.getItems().get(0).getLineOffset()).isZero();
        assertThat(first.getTotal()).isEqualTo(25L);
        assertThat(first.hasMore()).isTrue();
        assertThat(last.getItems()).extracting(LogRecord::getLineOffset).containsExactly(20L, 21L, 22L, 23L, 24L);
        assertThat(last.hasMore()).isFalse();
    }

    @Test
    @DisplayName("Should combine field filters")
    void shouldFilterByFields() {
        RecordFilter filter = RecordFilter.builder(FROM, TO)
            .clientIp("10.0.0.1")
            .statusCode(404)
            .method("get")
            .build();

        Page<LogRecord> page = store.find(filter, 0, 100);

        assertThat(page.getItems()).extracting(LogRecord::getLineOffset).containsExactly(0L, 10L, 20L);
    }

    @Test
    @DisplayName("Should match path fragments case-insensitively")
    void shouldFilterByPath() {
        Page<LogRecord> page = store.find(RecordFilter.builder(FROM, TO).pathContains("ITEM/1").build(), 0, 100);

        assertThat(page.getTotal()).isEqualTo(11L);
    }

    @Test
    @DisplayName("Should treat the range as half-open")
    void shouldExcludeRangeEnd() {
        Page<LogRecord> page = store.find(RecordFilter.builder(T0, T0.plusSeconds(3)).build(), 0, 100);

        assertThat(page.getItems()).extracting(LogRecord::getLineOffset).containsExactly(0L, 1L, 2L);
    }

    @Test
    @DisplayName("Should keep one copy of a record appended twice")
    void shouldBeIdempotentById() {
        store.append(TestRecords.at(T0, "10.0.0.1", "/api/item/0", 404, 0));

        assertThat(store.count()).isEqualTo(25L);
    }
}
