package com.jsoonworld.delivery.domain.model;

import java.time.Instant;
import java.util.Map;

public record NotificationRequest(
    String templateId,
    NotificationType type,
    String recipientId,
    String scopeId,
    String title,
    String message,
    Map<String, String> variables,
    NotificationPriority priority,
    Integer maxRetries
) {
    public Notification toNotification(String notificationId, Instant now, int defaultMaxRetries) {
        return Notification.builder()
            .id(notificationId)
            .templateId(templateId)
            .type(type)
            .priority(priority != null ? priority : NotificationPriority.MEDIUM)
            .recipientId(recipientId)
            .scopeId(scopeId)
            .content(new NotificationContent(title, message))
            .variables(variables)
            .createdAt(now)
            .scheduledFor(now)
            .maxRetries(maxRetries != null ? maxRetries : defaultMaxRetries)
            .build();
    }
}
