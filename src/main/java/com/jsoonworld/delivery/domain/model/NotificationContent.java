package com.jsoonworld.delivery.domain.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record NotificationContent(
    @NotBlank @Size(max = 100) String title,
    @NotBlank @Size(max = 2000) String message
) {
}
