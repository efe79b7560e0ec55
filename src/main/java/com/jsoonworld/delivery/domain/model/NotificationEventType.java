package com.jsoonworld.delivery.domain.model;

public enum NotificationEventType {
    SENT("notification.sent"),
    ERROR("notification.error"),
    QUEUED("notification.queued"),
    RATE_LIMITED("notification.rateLimit"),
    SCHEDULED("notification.scheduled"),
    CANCELLED("notification.cancelled"),
    BATCH_PROCESSING("batch.processing"),
    BATCH_COMPLETED("batch.completed");

    private final String eventName;

    NotificationEventType(String eventName) {
        this.eventName = eventName;
    }

    public String eventName() {
        return eventName;
    }
}
