package com.jsoonworld.delivery.domain.service;

import com.jsoonworld.delivery.domain.model.NotificationEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

// slow subscribers miss events instead of stalling delivery
public class NotificationEventBus {

    private static final Logger log = LoggerFactory.getLogger(NotificationEventBus.class);

    private final Sinks.Many<NotificationEvent> sink = Sinks.many().multicast().directBestEffort();

    public synchronized void publish(NotificationEvent event) {
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("Failed to publish event: event={}, notificationId={}, result={}",
                event.name(), event.notificationId(), result);
        }
    }

    public Flux<NotificationEvent> events() {
        return sink.asFlux();
    }
}
