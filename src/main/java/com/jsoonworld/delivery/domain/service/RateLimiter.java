package com.jsoonworld.delivery.domain.service;

import com.jsoonworld.delivery.domain.model.RateLimitConfig;
import com.jsoonworld.delivery.domain.model.RateLimitState;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed-window admission control, one window per scope.
 *
 * <p>{@link #admit} only decides; quota is consumed by {@link #recordSuccess}
 * after a delivery went through. Callers that need check-then-record to be
 * atomic for a scope must serialise on that scope themselves (see
 * {@link ScopeLock}).
 */
public class RateLimiter {

    private final RateLimitConfig config;
    private final Clock clock;
    private final Map<String, RateLimitState> states = new ConcurrentHashMap<>();

    public RateLimiter(RateLimitConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("RateLimitConfig must not be null");
        }
        this.config = config;
        this.clock = clock;
    }

    public boolean admit(String scopeId) {
        Instant now = clock.instant();
        RateLimitState state = states.get(scopeId);
        if (state == null) {
            return true;
        }
        if (state.isExpired(now, config.windowMs())) {
            states.remove(scopeId, state);
            return true;
        }
        return state.requestCount() < config.requestsPerSecond();
    }

    public void recordSuccess(String scopeId) {
        Instant now = clock.instant();
        states.compute(scopeId, (key, state) -> {
            if (state == null || state.isExpired(now, config.windowMs())) {
                return RateLimitState.start(key, now);
            }
            return state.increment(now);
        });
    }

    public Duration retryAfter(String scopeId) {
        RateLimitState state = states.get(scopeId);
        if (state == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(clock.instant(), state.windowEnd(config.windowMs()));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public RateLimitState stateOf(String scopeId) {
        return states.get(scopeId);
    }
}
