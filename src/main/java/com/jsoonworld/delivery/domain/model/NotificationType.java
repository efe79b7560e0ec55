package com.jsoonworld.delivery.domain.model;

public enum NotificationType {
    TASK_REMINDER,
    TASK_DUE,
    TASK_OVERDUE,
    TASK_ASSIGNED,
    TASK_STATUS_CHANGED,
    TASK_COMPLETED,

    SYSTEM_ALERT;

    /**
     * Maps the task service's event type string onto a notification type.
     * e.g. "task.reminder" -> TASK_REMINDER
     */
    public static NotificationType fromEventTypeString(String eventType) {
        return switch (eventType) {
            case "task.reminder" -> TASK_REMINDER;
            case "task.due" -> TASK_DUE;
            case "task.overdue" -> TASK_OVERDUE;
            case "task.assigned" -> TASK_ASSIGNED;
            case "task.status-changed" -> TASK_STATUS_CHANGED;
            case "task.completed" -> TASK_COMPLETED;
            case "system.alert" -> SYSTEM_ALERT;
            default -> throw new IllegalArgumentException("Unknown event type: " + eventType);
        };
    }
}
