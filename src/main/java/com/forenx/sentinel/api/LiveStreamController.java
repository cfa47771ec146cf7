package com.forenx.sentinel.api;

import com.forenx.sentinel.live.LiveEvent;
import com.forenx.sentinel.live.LiveEventChannel;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/**
 * Server-Sent Events stream of committed records and raised alerts.
 * There is no replay: a subscriber sees events published while it is connected.
 */
@RestController
public class LiveStreamController {

    private final LiveEventChannel channel;

    public LiveStreamController(LiveEventChannel channel) {
        this.channel = channel;
    }

    @GetMapping(value = "/api/live", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<LiveEvent>> live(@RequestParam(required = false) String type) {
        Flux<LiveEvent> events = channel.subscribe();
        if (type != null && !type.isBlank()) {
            events = events.filter(e -> e.getType().getValue().equalsIgnoreCase(type));
        }
        return events.map(e -> ServerSentEvent.<LiveEvent>builder()
            .event(e.getType().getValue())
            .data(e)
            .build());
    }
}
