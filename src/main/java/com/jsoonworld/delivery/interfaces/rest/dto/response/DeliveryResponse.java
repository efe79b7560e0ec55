package com.jsoonworld.delivery.interfaces.rest.dto.response;

import com.jsoonworld.delivery.domain.model.DeliveryResult;
import com.jsoonworld.delivery.domain.model.DispatchOutcome;
import com.jsoonworld.delivery.domain.model.NotificationStatus;

import java.time.Instant;

public record DeliveryResponse(
        String notificationId,
        boolean success,
        DispatchOutcome outcome,
        NotificationStatus status,
        int retryCount,
        String error,
        Instant sentAt
) {
    public static DeliveryResponse from(DeliveryResult result) {
        return new DeliveryResponse(
                result.notificationId(),
                result.isSuccess(),
                result.outcome(),
                result.status(),
                result.retryCount(),
                result.errorMessage(),
                result.sentAt()
        );
    }
}
