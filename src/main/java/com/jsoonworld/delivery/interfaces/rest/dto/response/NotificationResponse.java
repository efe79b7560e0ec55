package com.jsoonworld.delivery.interfaces.rest.dto.response;

import com.jsoonworld.delivery.domain.model.Notification;
import com.jsoonworld.delivery.domain.model.NotificationPriority;
import com.jsoonworld.delivery.domain.model.NotificationStatus;
import com.jsoonworld.delivery.domain.model.NotificationType;

import java.time.Instant;

public record NotificationResponse(
        String id,
        NotificationType type,
        NotificationPriority priority,
        String scopeId,
        String recipientId,
        NotificationStatus status,
        int retryCount,
        int maxRetries,
        Instant createdAt
) {
    public static NotificationResponse from(Notification notification) {
        return new NotificationResponse(
                notification.getId(),
                notification.getType(),
                notification.getPriority(),
                notification.getScopeId(),
                notification.getRecipientId(),
                notification.getStatus(),
                notification.getRetryCount(),
                notification.getMaxRetries(),
                notification.getCreatedAt()
        );
    }
}
