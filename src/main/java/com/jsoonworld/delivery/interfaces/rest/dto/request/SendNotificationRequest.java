package com.jsoonworld.delivery.interfaces.rest.dto.request;

import com.jsoonworld.delivery.domain.model.NotificationPriority;
import com.jsoonworld.delivery.domain.model.NotificationRequest;
import com.jsoonworld.delivery.domain.model.NotificationType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.Map;

public record SendNotificationRequest(
        @NotBlank String templateId,
        @NotNull NotificationType type,
        @NotBlank String recipientId,
        @NotBlank String scopeId,
        @NotBlank @Size(max = 100) String title,
        @NotBlank @Size(max = 2000) String message,
        Map<String, String> variables,
        NotificationPriority priority,
        @Min(0) @Max(10) Integer maxRetries
) {
    public NotificationRequest toDomain() {
        return new NotificationRequest(templateId, type, recipientId, scopeId,
                title, message, variables, priority, maxRetries);
    }
}
