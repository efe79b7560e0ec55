package com.jsoonworld.delivery.interfaces.rest.dto.response;

import com.jsoonworld.delivery.domain.model.EngineStats;
import com.jsoonworld.delivery.domain.model.NotificationPriority;

import java.util.Map;

public record StatsResponse(
        boolean running,
        Map<NotificationPriority, Integer> queueStats,
        Map<String, Integer> retryQueueStats,
        int totalQueued,
        int totalRetrying,
        int scheduledJobs
) {
    public static StatsResponse from(EngineStats stats, boolean running) {
        return new StatsResponse(
                running,
                stats.queueStats(),
                stats.retryQueueStats(),
                stats.totalQueued(),
                stats.totalRetrying(),
                stats.scheduledJobs()
        );
    }
}
