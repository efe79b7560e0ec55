package com.jsoonworld.delivery.domain.model;

import java.time.Duration;

// requestsPerSecond is the cap per window of windowMs
public record RateLimitConfig(int requestsPerSecond, long windowMs) {

    public static final int MIN_REQUESTS = 1;
    public static final int MAX_REQUESTS = 100;
    public static final long MIN_WINDOW_MS = 100;

    public RateLimitConfig {
        if (requestsPerSecond < MIN_REQUESTS || requestsPerSecond > MAX_REQUESTS) {
            throw new IllegalArgumentException(
                "requestsPerSecond must be between " + MIN_REQUESTS + " and " + MAX_REQUESTS
                    + ", was " + requestsPerSecond);
        }
        if (windowMs < MIN_WINDOW_MS) {
            throw new IllegalArgumentException(
                "windowMs must be at least " + MIN_WINDOW_MS + ", was " + windowMs);
        }
    }

    public static RateLimitConfig defaults() {
        return new RateLimitConfig(50, 1000);
    }

    public Duration window() {
        return Duration.ofMillis(windowMs);
    }
}
