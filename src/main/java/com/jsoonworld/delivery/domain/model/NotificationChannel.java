package com.jsoonworld.delivery.domain.model;

public enum NotificationChannel {
    DISCORD,
    LOG
}
