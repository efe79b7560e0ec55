package com.jsoonworld.delivery.domain.model;

// declaration order is drain order
public enum NotificationPriority {
    URGENT,
    HIGH,
    MEDIUM,
    LOW
}
