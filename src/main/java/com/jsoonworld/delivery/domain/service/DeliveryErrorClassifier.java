package com.jsoonworld.delivery.domain.service;

import com.jsoonworld.delivery.domain.exception.DeliveryException;
import com.jsoonworld.delivery.domain.model.DeliveryErrorKind;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

public class DeliveryErrorClassifier {

    private static final List<String> RETRYABLE_KEYWORDS = List.of(
        "network",
        "timeout",
        "temporarily",
        "5xx",
        "server error"
    );

    public DeliveryErrorKind classify(Throwable error) {
        if (error instanceof DeliveryException deliveryException) {
            return deliveryException.kind();
        }
        if (error instanceof TimeoutException) {
            return DeliveryErrorKind.RETRYABLE;
        }
        return classifyMessage(error != null ? error.getMessage() : null);
    }

    public DeliveryErrorKind classifyMessage(String message) {
        if (message == null || message.isBlank()) {
            return DeliveryErrorKind.FATAL;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        return RETRYABLE_KEYWORDS.stream().anyMatch(normalized::contains)
            ? DeliveryErrorKind.RETRYABLE
            : DeliveryErrorKind.FATAL;
    }
}
