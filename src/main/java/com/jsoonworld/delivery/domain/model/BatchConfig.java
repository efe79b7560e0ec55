package com.jsoonworld.delivery.domain.model;

import java.time.Duration;

public record BatchConfig(int maxBatchSize, long processingIntervalMs) {

    public static final int MAX_BATCH_SIZE_LIMIT = 1000;
    public static final long MIN_PROCESSING_INTERVAL_MS = 10;

    public BatchConfig {
        if (maxBatchSize < 1 || maxBatchSize > MAX_BATCH_SIZE_LIMIT) {
            throw new IllegalArgumentException(
                "maxBatchSize must be between 1 and " + MAX_BATCH_SIZE_LIMIT + ", was " + maxBatchSize);
        }
        if (processingIntervalMs < MIN_PROCESSING_INTERVAL_MS) {
            throw new IllegalArgumentException(
                "processingIntervalMs must be at least " + MIN_PROCESSING_INTERVAL_MS
                    + ", was " + processingIntervalMs);
        }
    }

    public static BatchConfig defaults() {
        return new BatchConfig(10, 1000);
    }

    public Duration processingInterval() {
        return Duration.ofMillis(processingIntervalMs);
    }
}
