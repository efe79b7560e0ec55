package com.jsoonworld.delivery.domain.exception;

import com.jsoonworld.delivery.domain.model.DeliveryErrorKind;

public class DeliveryException extends NotificationException {

    private final DeliveryErrorKind kind;

    public DeliveryException(DeliveryErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DeliveryException(DeliveryErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static DeliveryException retryable(String message) {
        return new DeliveryException(DeliveryErrorKind.RETRYABLE, message);
    }

    public static DeliveryException fatal(String message) {
        return new DeliveryException(DeliveryErrorKind.FATAL, message);
    }

    public DeliveryErrorKind kind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind == DeliveryErrorKind.RETRYABLE;
    }
}
