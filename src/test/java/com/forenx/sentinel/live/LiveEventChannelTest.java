package com.forenx.sentinel.live;

import com.forenx.sentinel.domain.LogRecord;
import com.forenx.sentinel.domain.TestRecords;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static com.forenx.sentinel.domain.TestRecords.T0;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LiveEventChannel Tests")
class LiveEventChannelTest {

    private LiveEventChannel channel;

    @BeforeEach
    void setUp() {
        channel = new LiveEventChannel(2, new SimpleMeterRegistry());
    }

    private static LiveEvent committed(long offset) {
        return LiveEvent.recordCommitted(TestRecords.at(T0.plusSeconds(offset), "10.0.0.1", "/", 200, offset));
    }

    private static long offsetOf(LiveEvent event) {
        return ((LogRecord) event.getPayload()).getLineOffset();
    }

    @Test
    @DisplayName("Should deliver events published while subscribed")
    void shouldDeliverToSubscribers() {
        StepVerifier.create(channel.subscribe())
            .then(() -> {
                assertThat(channel.subscriberCount()).isEqualTo(1);
                channel.publish(committed(0));
                channel.publish(committed(1));
                channel.complete();
            })
            .assertNext(e -> assertThat(offsetOf(e)).isZero())
            .assertNext(e -> {
                assertThat(e.getType()).isEqualTo(LiveEvent.Type.RECORD_COMMITTED);
                assertThat(offsetOf(e)).isEqualTo(1L);
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("Should not replay events published before subscription")
    void shouldNotReplay() {
        channel.publish(committed(0));

        StepVerifier.create(channel.subscribe())
            .then(() -> {
                channel.publish(committed(1));
                channel.complete();
            })
            .assertNext(e -> assertThat(offsetOf(e)).isEqualTo(1L))
            .verifyComplete();
    }

    @Test
    @DisplayName("Should drop the oldest events for a slow subscriber and count them")
    void shouldDropOldestForSlowSubscriber() {
        StepVerifier.create(channel.subscribe(), 0)
            .then(() -> {
                for (long i = 0; i < 5; i++) {
                    channel.publish(committed(i));
                }
                channel.complete();
            })
            .thenRequest(10)
            .assertNext(e -> assertThat(offsetOf(e)).isEqualTo(3L))
            .assertNext(e -> assertThat(offsetOf(e)).isEqualTo(4L))
            .verifyComplete();

        assertThat(channel.getDroppedCount()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should accept publishing without subscribers")
    void shouldPublishWithoutSubscribers() {
        channel.publish(committed(0));

        assertThat(channel.subscriberCount()).isZero();
        assertThat(channel.getDroppedCount()).isZero();
    }
}
