package com.jsoonworld.delivery.domain.exception;

import java.util.List;

public class NotificationValidationException extends NotificationException {

    private final List<String> violations;

    public NotificationValidationException(List<String> violations) {
        super("Invalid notification: " + String.join(", ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
