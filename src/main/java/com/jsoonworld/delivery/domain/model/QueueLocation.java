package com.jsoonworld.delivery.domain.model;

public enum QueueLocation {
    NONE,
    RETRY,
    BATCH
}
