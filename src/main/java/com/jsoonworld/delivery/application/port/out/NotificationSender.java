package com.jsoonworld.delivery.application.port.out;

import com.jsoonworld.delivery.domain.model.NotificationChannel;
import com.jsoonworld.delivery.domain.model.NotificationContent;
import reactor.core.publisher.Mono;

public interface NotificationSender {

    Mono<Void> deliver(String recipientId, NotificationContent content);

    NotificationChannel channel();

    default Mono<Boolean> isAvailable() {
        return Mono.just(true);
    }
}
