package com.jsoonworld.delivery.domain.exception;

public class NotificationStateException extends NotificationException {

    public NotificationStateException(String message) {
        super(message);
    }
}
