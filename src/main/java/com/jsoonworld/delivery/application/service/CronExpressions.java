package com.jsoonworld.delivery.application.service;

import com.jsoonworld.delivery.domain.exception.NotificationValidationException;
import org.springframework.scheduling.support.CronExpression;

import java.util.List;

// five-field cron in, Spring six-field cron out
final class CronExpressions {

    private CronExpressions() {
    }

    static String normalize(String cronExpression) {
        if (cronExpression == null || cronExpression.isBlank()) {
            throw new NotificationValidationException(List.of("cronExpression must not be blank"));
        }
        String trimmed = cronExpression.trim().replaceAll("\\s+", " ");
        String normalized = trimmed.split(" ").length == 5 ? "0 " + trimmed : trimmed;
        if (!CronExpression.isValidExpression(normalized)) {
            throw new NotificationValidationException(
                List.of("cronExpression is invalid: " + cronExpression));
        }
        return normalized;
    }
}
