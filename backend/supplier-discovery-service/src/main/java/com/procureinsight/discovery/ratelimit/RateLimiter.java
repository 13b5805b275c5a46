package com.procureinsight.discovery.ratelimit;

import java.time.Duration;

/**
 * Per-key admission control. Every key owns independent state.
 */
public interface RateLimiter {

    String getName();

    default RateLimitDecision tryAcquire(String key) {
        return tryAcquire(key, 1);
    }

    RateLimitDecision tryAcquire(String key, int permits);

    /**
     * Current maximum admissions per window (sliding window) or bucket capacity (token bucket)
     */
    int getLimit();

    /**
     * Interval the limit applies to. For a token bucket this is the time to refill from empty.
     */
    Duration getWindow();

    void updateLimit(int newLimit);

    /**
     * Permits currently in use for the key: admitted events in the window, or consumed tokens
     */
    int occupancy(String key);

    /**
     * Number of keys with live state
     */
    int activeKeys();
}
