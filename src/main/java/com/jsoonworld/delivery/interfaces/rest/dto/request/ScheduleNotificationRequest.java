package com.jsoonworld.delivery.interfaces.rest.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ScheduleNotificationRequest(
        @NotNull @Valid SendNotificationRequest notification,
        @NotBlank String cronExpression
) {
}
