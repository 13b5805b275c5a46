package com.procureinsight.discovery.ratelimit;

import java.time.Duration;

/**
 * Outcome of one admission check. A rejection carries the wait before a retry can succeed.
 */
public record RateLimitDecision(
        boolean allowed,
        int limit,
        Duration window,
        int remaining,
        Duration retryAfter
) {
    public static RateLimitDecision allow(int limit, Duration window, int remaining) {
        return new RateLimitDecision(true, limit, window, remaining, Duration.ZERO);
    }

    public static RateLimitDecision reject(int limit, Duration window, Duration retryAfter) {
        Duration wait = retryAfter.isNegative() || retryAfter.isZero() ? Duration.ofMillis(1) : retryAfter;
        return new RateLimitDecision(false, limit, window, 0, wait);
    }

    /**
     * Whole seconds to advertise in a Retry-After header, at least one.
     */
    public long retryAfterSeconds() {
        long seconds = (retryAfter.toMillis() + 999) / 1000;
        return Math.max(1, seconds);
    }
}
