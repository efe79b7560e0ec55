package com.jsoonworld.delivery.application.port.in;

import com.jsoonworld.delivery.domain.model.Notification;
import com.jsoonworld.delivery.domain.model.NotificationRequest;

public interface ScheduleNotificationUseCase {

    Notification scheduleRecurring(NotificationRequest request, String cronExpression);

    boolean cancel(String notificationId);
}
