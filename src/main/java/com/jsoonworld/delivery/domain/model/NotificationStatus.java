package com.jsoonworld.delivery.domain.model;

public enum NotificationStatus {
    PENDING,
    RETRY,
    SENT,
    FAILED,
    CANCELLED
}
