package com.jsoonworld.delivery.domain.model;

public enum DeliveryErrorKind {
    RETRYABLE,
    FATAL
}
