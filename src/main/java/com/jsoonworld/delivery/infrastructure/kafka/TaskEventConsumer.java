package com.jsoonworld.delivery.infrastructure.kafka;

import com.fasterxml.jackson.databind.JsonNode;
import com.jsoonworld.delivery.application.port.in.SendNotificationUseCase;
import com.jsoonworld.delivery.domain.exception.NotificationException;
import com.jsoonworld.delivery.domain.model.Notification;
import com.jsoonworld.delivery.domain.model.NotificationPriority;
import com.jsoonworld.delivery.domain.model.NotificationRequest;
import com.jsoonworld.delivery.domain.model.NotificationType;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.Locale;

// unusable records are logged and acknowledged, redelivery would fail the same way
@Component
public class TaskEventConsumer {

    private static final Logger log = LoggerFactory.getLogger(TaskEventConsumer.class);
    private static final String CONSUMER_GROUP = "notif-task";

    private final SendNotificationUseCase sendNotificationUseCase;
    private final EventDeserializer eventDeserializer;

    public TaskEventConsumer(SendNotificationUseCase sendNotificationUseCase,
                             EventDeserializer eventDeserializer) {
        this.sendNotificationUseCase = sendNotificationUseCase;
        this.eventDeserializer = eventDeserializer;
    }

    @KafkaListener(
        topics = "${delivery.kafka.topic:taskbot.task.events}",
        groupId = CONSUMER_GROUP,
        autoStartup = "${delivery.kafka.enabled:false}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.info("Received task event: topic={}, partition={}, offset={}",
            record.topic(), record.partition(), record.offset());
        try {
            NotificationRequest request = toRequest(record);
            Notification notification = sendNotificationUseCase.queue(request);
            log.info("Task event queued for delivery: notificationId={}, type={}, scopeId={}",
                notification.getId(), notification.getType(), notification.getScopeId());
        } catch (EventDeserializer.DeserializationException | NotificationException | IllegalArgumentException e) {
            log.error("Failed to process task event: topic={}, offset={}, error={}",
                record.topic(), record.offset(), e.getMessage());
        } finally {
            ack.acknowledge();
        }
    }

    NotificationRequest toRequest(ConsumerRecord<String, String> record) {
        JsonNode node = eventDeserializer.deserialize(record.value());
        String eventId = eventDeserializer.extractEventId(node);
        NotificationType type = NotificationType.fromEventTypeString(eventDeserializer.extractEventType(node));
        JsonNode payload = eventDeserializer.extractPayload(node);
        log.debug("Mapping task event: eventId={}, type={}", eventId, type);

        String title = eventDeserializer.optionalText(payload, "title");
        String message = eventDeserializer.optionalText(payload, "message");
        String priority = eventDeserializer.optionalText(payload, "priority");
        String templateId = eventDeserializer.optionalText(payload, "templateId");

        return new NotificationRequest(
            templateId != null ? templateId : defaultTemplateId(type),
            type,
            eventDeserializer.optionalText(payload, "channelId"),
            eventDeserializer.optionalText(payload, "serverId"),
            title != null ? title : resolveTitle(type),
            message != null ? message : resolveMessage(type, payload),
            eventDeserializer.extractVariables(payload),
            priority != null ? parsePriority(priority) : resolvePriority(type),
            null
        );
    }

    private NotificationPriority parsePriority(String priority) {
        return NotificationPriority.valueOf(priority.trim().toUpperCase(Locale.ROOT));
    }

    private String defaultTemplateId(NotificationType type) {
        return "default-" + type.name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    private String resolveTitle(NotificationType type) {
        return switch (type) {
            case TASK_REMINDER -> "Task reminder";
            case TASK_DUE -> "Task due";
            case TASK_OVERDUE -> "Task overdue";
            case TASK_ASSIGNED -> "Task assigned";
            case TASK_STATUS_CHANGED -> "Task status changed";
            case TASK_COMPLETED -> "Task completed";
            case SYSTEM_ALERT -> "System alert";
        };
    }

    private String resolveMessage(NotificationType type, JsonNode payload) {
        String taskTitle = eventDeserializer.optionalText(payload, "taskTitle");
        if (taskTitle == null) {
            return resolveTitle(type);
        }
        return switch (type) {
            case TASK_STATUS_CHANGED -> {
                String status = eventDeserializer.optionalText(payload, "status");
                yield status != null ? taskTitle + " is now " + status : taskTitle;
            }
            default -> taskTitle;
        };
    }

    private NotificationPriority resolvePriority(NotificationType type) {
        return switch (type) {
            case TASK_OVERDUE, SYSTEM_ALERT -> NotificationPriority.URGENT;
            case TASK_DUE -> NotificationPriority.HIGH;
            case TASK_COMPLETED -> NotificationPriority.LOW;
            default -> NotificationPriority.MEDIUM;
        };
    }
}
