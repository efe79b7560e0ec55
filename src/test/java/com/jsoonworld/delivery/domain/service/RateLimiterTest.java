package com.jsoonworld.delivery.domain.service;

import com.jsoonworld.delivery.domain.model.RateLimitConfig;
import com.jsoonworld.delivery.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimiterTest {

    private MutableClock clock;
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T09:00:00Z");
        rateLimiter = new RateLimiter(new RateLimitConfig(2, 1000), clock);
    }

    @Test
    void admit_doesNotConsumeQuota() {
        assertThat(rateLimiter.admit("guild-1")).isTrue();
        assertThat(rateLimiter.admit("guild-1")).isTrue();
        assertThat(rateLimiter.admit("guild-1")).isTrue();
        assertThat(rateLimiter.stateOf("guild-1")).isNull();
    }

    @Test
    void admit_deniesOnceCapIsRecorded() {
        rateLimiter.recordSuccess("guild-1");
        assertThat(rateLimiter.admit("guild-1")).isTrue();

        clock.advance(Duration.ofMillis(200));
        rateLimiter.recordSuccess("guild-1");

        assertThat(rateLimiter.admit("guild-1")).isFalse();
        assertThat(rateLimiter.stateOf("guild-1").requestCount()).isEqualTo(2);
        assertThat(rateLimiter.retryAfter("guild-1")).isEqualTo(Duration.ofMillis(800));
    }

    @Test
    void admit_scopesAreIndependent() {
        rateLimiter.recordSuccess("guild-1");
        rateLimiter.recordSuccess("guild-1");

        assertThat(rateLimiter.admit("guild-1")).isFalse();
        assertThat(rateLimiter.admit("guild-2")).isTrue();
        assertThat(rateLimiter.retryAfter("guild-2")).isEqualTo(Duration.ZERO);
    }

    @Test
    void admit_windowExpiry_resetsScope() {
        rateLimiter.recordSuccess("guild-1");
        rateLimiter.recordSuccess("guild-1");

        clock.advance(Duration.ofMillis(1000));
        assertThat(rateLimiter.admit("guild-1")).isFalse();

        clock.advance(Duration.ofMillis(1));
        assertThat(rateLimiter.admit("guild-1")).isTrue();
        assertThat(rateLimiter.stateOf("guild-1")).isNull();

        rateLimiter.recordSuccess("guild-1");
        assertThat(rateLimiter.stateOf("guild-1").requestCount()).isEqualTo(1);
        assertThat(rateLimiter.stateOf("guild-1").windowStart()).isEqualTo(clock.instant());
    }
}
