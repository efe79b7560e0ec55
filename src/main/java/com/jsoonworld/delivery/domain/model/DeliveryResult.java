package com.jsoonworld.delivery.domain.model;

import java.time.Instant;

public record DeliveryResult(
    String notificationId,
    DispatchOutcome outcome,
    NotificationStatus status,
    int retryCount,
    String errorMessage,
    Instant sentAt
) {
    public static DeliveryResult of(Notification notification, DispatchOutcome outcome) {
        return new DeliveryResult(
            notification.getId(),
            outcome,
            notification.getStatus(),
            notification.getRetryCount(),
            notification.getError(),
            notification.getSentAt()
        );
    }

    public boolean isSuccess() {
        return outcome == DispatchOutcome.SENT;
    }
}
