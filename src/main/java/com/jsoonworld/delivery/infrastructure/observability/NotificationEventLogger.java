package com.jsoonworld.delivery.infrastructure.observability;

import com.jsoonworld.delivery.domain.model.NotificationEvent;
import com.jsoonworld.delivery.domain.service.NotificationEventBus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;

@Component
public class NotificationEventLogger {

    private static final Logger log = LoggerFactory.getLogger(NotificationEventLogger.class);

    private final NotificationEventBus eventBus;
    private Disposable subscription;

    public NotificationEventLogger(NotificationEventBus eventBus) {
        this.eventBus = eventBus;
    }

    @PostConstruct
    public void subscribe() {
        subscription = eventBus.events().subscribe(this::logEvent);
    }

    @PreDestroy
    public void unsubscribe() {
        if (subscription != null) {
            subscription.dispose();
        }
    }

    void logEvent(NotificationEvent event) {
        switch (event.type()) {
            case ERROR -> log.info("event={}, notificationId={}, error={}",
                event.name(), event.notificationId(), event.errorMessage());
            case RATE_LIMITED -> log.info("event={}, notificationId={}, retryAfter={}ms",
                event.name(), event.notificationId(), event.retryAfter().toMillis());
            case BATCH_PROCESSING, BATCH_COMPLETED -> log.debug("event={}, size={}",
                event.name(), event.batchSize());
            default -> log.debug("event={}, notificationId={}", event.name(), event.notificationId());
        }
    }
}
