package com.jsoonworld.delivery.domain.model;

import java.util.Map;

public record EngineStats(
    Map<NotificationPriority, Integer> queueStats,
    Map<String, Integer> retryQueueStats,
    int scheduledJobs
) {
    public int totalQueued() {
        return queueStats.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int totalRetrying() {
        return retryQueueStats.values().stream().mapToInt(Integer::intValue).sum();
    }
}
