package com.jsoonworld.delivery.infrastructure.sender;

import com.jsoonworld.delivery.application.port.out.NotificationSender;
import com.jsoonworld.delivery.domain.model.NotificationChannel;
import com.jsoonworld.delivery.domain.model.NotificationContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
@ConditionalOnProperty(name = "delivery.discord.enabled", havingValue = "false", matchIfMissing = true)
public class LogOnlySender implements NotificationSender {

    private static final Logger log = LoggerFactory.getLogger(LogOnlySender.class);

    @Override
    public Mono<Void> deliver(String recipientId, NotificationContent content) {
        log.info("Log-only delivery: recipientId={}, title={}", recipientId, content.title());
        return Mono.empty();
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.LOG;
    }
}
