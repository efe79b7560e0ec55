package com.jsoonworld.delivery.support;

import com.jsoonworld.delivery.domain.model.Notification;
import com.jsoonworld.delivery.domain.model.NotificationContent;
import com.jsoonworld.delivery.domain.model.NotificationPriority;
import com.jsoonworld.delivery.domain.model.NotificationRequest;
import com.jsoonworld.delivery.domain.model.NotificationType;

import java.time.Instant;
import java.util.Map;

public final class TestNotifications {

    public static final Instant CREATED_AT = Instant.parse("2024-05-01T09:00:00Z");

    private TestNotifications() {
    }

    public static Notification notification(String id, String scopeId) {
        return notification(id, scopeId, NotificationPriority.MEDIUM, 3);
    }

    public static Notification notification(String id, String scopeId, NotificationPriority priority) {
        return notification(id, scopeId, priority, 3);
    }

    public static Notification notification(String id, String scopeId, NotificationPriority priority, int maxRetries) {
        return Notification.builder()
            .id(id)
            .templateId("task-reminder")
            .type(NotificationType.TASK_REMINDER)
            .priority(priority)
            .recipientId("channel-" + scopeId)
            .scopeId(scopeId)
            .content(new NotificationContent(id, "Standup in 10 minutes"))
            .variables(Map.of("task", "standup"))
            .createdAt(CREATED_AT)
            .maxRetries(maxRetries)
            .build();
    }

    public static NotificationRequest request(String scopeId, String title) {
        return new NotificationRequest(
            "task-reminder",
            NotificationType.TASK_REMINDER,
            "channel-" + scopeId,
            scopeId,
            title,
            "Standup in 10 minutes",
            Map.of("task", "standup"),
            NotificationPriority.HIGH,
            null
        );
    }
}
