package com.jsoonworld.delivery.domain.model;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

public record ScheduledJob(
    String notificationId,
    String cronExpression,
    Notification notification,
    ScheduledFuture<?> future,
    Instant scheduledAt
) {
    public void stop() {
        future.cancel(false);
    }
}
