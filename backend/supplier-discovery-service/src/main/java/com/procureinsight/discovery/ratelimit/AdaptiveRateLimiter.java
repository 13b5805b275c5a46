package com.procureinsight.discovery.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Wraps another limiter and resizes its limit from the observed error ratio.
 *
 * Once per adjustment interval: an error ratio above 10% shrinks the limit by 20%, below 5%
 * grows it by 20%. The limit stays within {@code [baseLimit, maxLimit]}. Intervals with no
 * recorded outcome leave the limit unchanged.
 */
@Slf4j
public class AdaptiveRateLimiter implements RateLimiter {

    static final double HIGH_ERROR_RATIO = 0.10;
    static final double LOW_ERROR_RATIO = 0.05;
    static final double SHRINK_FACTOR = 0.8;
    static final double GROW_FACTOR = 1.2;

    private final RateLimiter delegate;
    private final int baseLimit;
    private final int maxLimit;
    private final Duration adjustmentInterval;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private double currentLimit;
    private long successCount;
    private long errorCount;
    private Instant lastAdjustment;

    public AdaptiveRateLimiter(RateLimiter delegate, int baseLimit, int maxLimit,
                               Duration adjustmentInterval, Clock clock) {
        if (baseLimit < 1 || maxLimit < baseLimit) {
            throw new IllegalArgumentException("expected 1 <= baseLimit <= maxLimit");
        }
        this.delegate = delegate;
        this.baseLimit = baseLimit;
        this.maxLimit = maxLimit;
        this.adjustmentInterval = adjustmentInterval;
        this.clock = clock;
        this.currentLimit = baseLimit;
        this.lastAdjustment = clock.instant();
        delegate.updateLimit(baseLimit);
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    @Override
    public RateLimitDecision tryAcquire(String key, int permits) {
        adjustIfDue();
        return delegate.tryAcquire(key, permits);
    }

    public void recordSuccess() {
        lock.lock();
        try {
            successCount++;
        } finally {
            lock.unlock();
        }
        adjustIfDue();
    }

    public void recordError() {
        lock.lock();
        try {
            errorCount++;
        } finally {
            lock.unlock();
        }
        adjustIfDue();
    }

    /**
     * Applies the adjustment rule if the interval has elapsed since the last one.
     */
    public void adjustIfDue() {
        Instant now = clock.instant();
        lock.lock();
        try {
            if (Duration.between(lastAdjustment, now).compareTo(adjustmentInterval) < 0) {
                return;
            }
            long total = successCount + errorCount;
            if (total == 0) {
                return;
            }
            double errorRatio = (double) errorCount / total;
            double previous = currentLimit;
            if (errorRatio > HIGH_ERROR_RATIO) {
                currentLimit = Math.max(baseLimit, currentLimit * SHRINK_FACTOR);
            } else if (errorRatio < LOW_ERROR_RATIO) {
                currentLimit = Math.min(maxLimit, currentLimit * GROW_FACTOR);
            }
            successCount = 0;
            errorCount = 0;
            lastAdjustment = now;
            delegate.updateLimit((int) Math.floor(currentLimit));
            if (previous != currentLimit) {
                log.info("Adjusted rate limit for {}: {} -> {} (error ratio {})",
                        getName(), (int) previous, getLimit(), String.format("%.2f", errorRatio));
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getLimit() {
        return delegate.getLimit();
    }

    @Override
    public Duration getWindow() {
        return delegate.getWindow();
    }

    /**
     * Manual override. The value is clamped to the adaptive bounds.
     */
    @Override
    public void updateLimit(int newLimit) {
        lock.lock();
        try {
            currentLimit = Math.max(baseLimit, Math.min(maxLimit, newLimit));
            delegate.updateLimit((int) currentLimit);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int occupancy(String key) {
        return delegate.occupancy(key);
    }

    @Override
    public int activeKeys() {
        return delegate.activeKeys();
    }

    public int getBaseLimit() {
        return baseLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }
}
