package com.jsoonworld.delivery.domain.model;

import java.time.Duration;
import java.time.Instant;

public record NotificationEvent(
    NotificationEventType type,
    Notification notification,
    String errorMessage,
    Duration retryAfter,
    Integer batchSize,
    Instant occurredAt
) {
    public static NotificationEvent sent(Notification notification) {
        return of(NotificationEventType.SENT, notification);
    }

    public static NotificationEvent error(Notification notification, String errorMessage) {
        return new NotificationEvent(NotificationEventType.ERROR, notification, errorMessage,
            null, null, Instant.now());
    }

    public static NotificationEvent queued(Notification notification) {
        return of(NotificationEventType.QUEUED, notification);
    }

    public static NotificationEvent rateLimited(Notification notification, Duration retryAfter) {
        return new NotificationEvent(NotificationEventType.RATE_LIMITED, notification, null,
            retryAfter, null, Instant.now());
    }

    public static NotificationEvent scheduled(Notification notification) {
        return of(NotificationEventType.SCHEDULED, notification);
    }

    public static NotificationEvent cancelled(Notification notification) {
        return of(NotificationEventType.CANCELLED, notification);
    }

    public static NotificationEvent batchProcessing(int size) {
        return new NotificationEvent(NotificationEventType.BATCH_PROCESSING, null, null,
            null, size, Instant.now());
    }

    public static NotificationEvent batchCompleted(int size) {
        return new NotificationEvent(NotificationEventType.BATCH_COMPLETED, null, null,
            null, size, Instant.now());
    }

    private static NotificationEvent of(NotificationEventType type, Notification notification) {
        return new NotificationEvent(type, notification, null, null, null, Instant.now());
    }

    public String name() {
        return type.eventName();
    }

    public String notificationId() {
        return notification != null ? notification.getId() : null;
    }
}
