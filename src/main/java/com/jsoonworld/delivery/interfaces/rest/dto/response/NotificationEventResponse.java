package com.jsoonworld.delivery.interfaces.rest.dto.response;

import com.jsoonworld.delivery.domain.model.NotificationEvent;

import java.time.Instant;

public record NotificationEventResponse(
        String event,
        String notificationId,
        String scopeId,
        String error,
        Long retryAfterMs,
        Integer batchSize,
        Instant occurredAt
) {
    public static NotificationEventResponse from(NotificationEvent event) {
        return new NotificationEventResponse(
                event.name(),
                event.notificationId(),
                event.notification() != null ? event.notification().getScopeId() : null,
                event.errorMessage(),
                event.retryAfter() != null ? event.retryAfter().toMillis() : null,
                event.batchSize(),
                event.occurredAt()
        );
    }
}
