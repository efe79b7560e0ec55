package com.jsoonworld.delivery.domain.service;

import com.jsoonworld.delivery.domain.exception.NotificationValidationException;
import com.jsoonworld.delivery.domain.model.Notification;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;

import java.util.List;
import java.util.Set;

public class NotificationValidator {

    private final Validator validator;

    public NotificationValidator(Validator validator) {
        this.validator = validator;
    }

    public Notification validate(Notification notification) {
        if (notification == null) {
            throw new NotificationValidationException(List.of("notification must not be null"));
        }
        Set<ConstraintViolation<Notification>> violations = validator.validate(notification);
        if (!violations.isEmpty()) {
            List<String> messages = violations.stream()
                .map(violation -> violation.getPropertyPath() + " " + violation.getMessage())
                .sorted()
                .toList();
            throw new NotificationValidationException(messages);
        }
        return notification;
    }
}
