package com.forenx.sentinel.live;

import com.forenx.sentinel.config.SentinelProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.BufferOverflowStrategy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Fan-out of committed records and raised alerts to live subscribers.
 *
 * Publishing never blocks ingestion. Each subscriber gets its own bounded buffer; when a slow
 * subscriber's buffer is full its oldest pending event is dropped and counted. Subscribers
 * only receive events published while they are subscribed; there is no replay.
 */
@Component
public class LiveEventChannel {

    private static final Logger log = LoggerFactory.getLogger(LiveEventChannel.class);

    private final Sinks.Many<LiveEvent> sink = Sinks.many().multicast().directBestEffort();
    private final int subscriberBuffer;
    private final Counter published;
    private final Counter dropped;

    @Autowired
    public LiveEventChannel(SentinelProperties properties, MeterRegistry registry) {
        this(properties.getLive().getSubscriberBuffer(), registry);
    }

    public LiveEventChannel(int subscriberBuffer, MeterRegistry registry) {
        this.subscriberBuffer = subscriberBuffer;
        this.published = Counter.builder("forenx.live.published")
            .description("Events published to live subscribers")
            .register(registry);
        this.dropped = Counter.builder("forenx.live.dropped")
            .description("Events dropped for slow live subscribers")
            .register(registry);
    }

    /**
     * Publishes to current subscribers. Safe to call from any thread.
     */
    public void publish(LiveEvent event) {
        Sinks.EmitResult result;
        synchronized (sink) {
            result = sink.tryEmitNext(event);
        }
        if (result.isSuccess()) {
            published.increment();
        } else if (result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("Live event {} not delivered: {}", event.getType().getValue(), result);
        }
    }

    public Flux<LiveEvent> subscribe() {
        return sink.asFlux()
            .onBackpressureBuffer(subscriberBuffer, e -> dropped.increment(), BufferOverflowStrategy.DROP_OLDEST)
            .doOnSubscribe(s -> log.debug("Live subscriber joined"))
            .doFinally(signal -> log.debug("Live subscriber left ({})", signal));
    }

    public int subscriberCount() {
        return sink.currentSubscriberCount();
    }

    public double getDroppedCount() {
        return dropped.count();
    }

    public void complete() {
        synchronized (sink) {
            sink.tryEmitComplete();
        }
    }
}
