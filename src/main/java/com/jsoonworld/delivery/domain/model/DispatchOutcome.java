package com.jsoonworld.delivery.domain.model;

public enum DispatchOutcome {
    SENT,
    RATE_LIMITED,
    FAILED_RETRYABLE,
    FAILED_FATAL
}
