package com.jsoonworld.delivery.domain.model;

import java.time.Instant;

public record RateLimitState(
    String scopeId,
    Instant windowStart,
    int requestCount,
    Instant lastRequest
) {
    public static RateLimitState start(String scopeId, Instant now) {
        return new RateLimitState(scopeId, now, 1, now);
    }

    public RateLimitState increment(Instant now) {
        return new RateLimitState(scopeId, windowStart, requestCount + 1, now);
    }

    public boolean isExpired(Instant now, long windowMs) {
        return now.toEpochMilli() - windowStart.toEpochMilli() > windowMs;
    }

    public Instant windowEnd(long windowMs) {
        return windowStart.plusMillis(windowMs);
    }
}
