package com.jsoonworld.delivery.application.port.in;

import com.jsoonworld.delivery.domain.model.DeliveryResult;
import com.jsoonworld.delivery.domain.model.Notification;
import com.jsoonworld.delivery.domain.model.NotificationRequest;
import reactor.core.publisher.Mono;

public interface SendNotificationUseCase {

    Mono<DeliveryResult> sendNow(NotificationRequest request);

    Mono<DeliveryResult> sendNow(Notification notification);

    Notification queue(NotificationRequest request);

    Notification queue(Notification notification);
}
