package com.procureinsight.discovery.ratelimit;

import com.procureinsight.discovery.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SlidingWindowRateLimiterTest {

    private MutableClock clock;
    private SlidingWindowRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        limiter = new SlidingWindowRateLimiter("inbound", 5, Duration.ofSeconds(60), clock);
    }

    @Test
    @DisplayName("six requests in one second: five admitted, the sixth told when to retry")
    void admitsUpToLimit() {
        // given
        int admitted = 0;
        RateLimitDecision last = null;

        // when
        for (int i = 0; i < 6; i++) {
            last = limiter.tryAcquire("10.0.0.1:/discover");
            if (last.allowed()) {
                admitted++;
            }
            clock.advance(Duration.ofMillis(150));
        }

        // then
        assertThat(admitted).isEqualTo(5);
        assertThat(last.allowed()).isFalse();
        assertThat(last.remaining()).isZero();
        assertThat(last.retryAfter()).isPositive();
        assertThat(last.retryAfter()).isLessThanOrEqualTo(Duration.ofSeconds(60));
        assertThat(last.retryAfterSeconds()).isEqualTo(60);
    }

    @Test
    @DisplayName("remaining counts down with each admission")
    void remainingCountsDown() {
        assertThat(limiter.tryAcquire("k").remaining()).isEqualTo(4);
        assertThat(limiter.tryAcquire("k").remaining()).isEqualTo(3);
        assertThat(limiter.occupancy("k")).isEqualTo(2);
    }

    @Test
    @DisplayName("capacity returns once the oldest admission leaves the window")
    void windowSlides() {
        for (int i = 0; i < 5; i++) {
            limiter.tryAcquire("k");
        }
        assertThat(limiter.tryAcquire("k").allowed()).isFalse();

        clock.advance(Duration.ofSeconds(60).plusMillis(1));

        assertThat(limiter.tryAcquire("k").allowed()).isTrue();
    }

    @Test
    @DisplayName("keys are limited independently")
    void keysAreIndependent() {
        for (int i = 0; i < 5; i++) {
            limiter.tryAcquire("a");
        }

        assertThat(limiter.tryAcquire("a").allowed()).isFalse();
        assertThat(limiter.tryAcquire("b").allowed()).isTrue();
        assertThat(limiter.activeKeys()).isEqualTo(2);
    }

    @Test
    @DisplayName("a request for more permits than remain is rejected without consuming any")
    void multiPermitRejection() {
        limiter.tryAcquire("k", 3);

        RateLimitDecision decision = limiter.tryAcquire("k", 3);

        assertThat(decision.allowed()).isFalse();
        assertThat(limiter.occupancy("k")).isEqualTo(3);
    }

    @Test
    @DisplayName("idle windows are evicted")
    void evictIdle() {
        limiter.tryAcquire("a");
        clock.advance(Duration.ofSeconds(30));
        limiter.tryAcquire("b");
        clock.advance(Duration.ofSeconds(31));

        int removed = limiter.evictIdle();

        assertThat(removed).isEqualTo(1);
        assertThat(limiter.activeKeys()).isEqualTo(1);
    }
}
