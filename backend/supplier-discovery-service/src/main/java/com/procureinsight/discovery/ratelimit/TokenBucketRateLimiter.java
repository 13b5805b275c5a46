package com.procureinsight.discovery.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket per key with capacity {@code C} and refill rate {@code r} tokens per second.
 * Buckets start full.
 */
public class TokenBucketRateLimiter implements RateLimiter {

    private final String name;
    private final double refillPerSecond;
    private final Clock clock;
    private final Map<String, BucketState> buckets = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private volatile int capacity;

    public TokenBucketRateLimiter(String name, int capacity, double refillPerSecond, Clock clock) {
        if (capacity < 1 || refillPerSecond <= 0) {
            throw new IllegalArgumentException("capacity and refill rate must be positive");
        }
        this.name = name;
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
        this.clock = clock;
    }

    private static final class BucketState {
        double tokens;
        Instant lastRefill;

        BucketState(double tokens, Instant lastRefill) {
            this.tokens = tokens;
            this.lastRefill = lastRefill;
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public RateLimitDecision tryAcquire(String key, int permits) {
        Instant now = clock.instant();
        lock.lock();
        try {
            int cap = capacity;
            BucketState bucket = buckets.computeIfAbsent(key, k -> new BucketState(cap, now));
            refill(bucket, now, cap);
            if (bucket.tokens >= permits) {
                bucket.tokens -= permits;
                return RateLimitDecision.allow(cap, getWindow(), (int) Math.floor(bucket.tokens));
            }
            double waitSeconds = (permits - bucket.tokens) / refillPerSecond;
            return RateLimitDecision.reject(cap, getWindow(), Duration.ofNanos((long) Math.ceil(waitSeconds * 1_000_000_000L)));
        } finally {
            lock.unlock();
        }
    }

    private void refill(BucketState bucket, Instant now, int cap) {
        long elapsedNanos = Duration.between(bucket.lastRefill, now).toNanos();
        if (elapsedNanos > 0) {
            bucket.tokens = Math.min(cap, bucket.tokens + elapsedNanos / 1_000_000_000.0 * refillPerSecond);
            bucket.lastRefill = now;
        } else if (bucket.tokens > cap) {
            bucket.tokens = cap;
        }
    }

    @Override
    public int getLimit() {
        return capacity;
    }

    @Override
    public Duration getWindow() {
        return Duration.ofMillis((long) Math.ceil(capacity / refillPerSecond * 1000));
    }

    @Override
    public void updateLimit(int newLimit) {
        capacity = Math.max(1, newLimit);
    }

    public double getRefillPerSecond() {
        return refillPerSecond;
    }

    @Override
    public int occupancy(String key) {
        Instant now = clock.instant();
        lock.lock();
        try {
            BucketState bucket = buckets.get(key);
            if (bucket == null) {
                return 0;
            }
            int cap = capacity;
            refill(bucket, now, cap);
            return (int) Math.ceil(cap - bucket.tokens);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int activeKeys() {
        lock.lock();
        try {
            return buckets.size();
        } finally {
            lock.unlock();
        }
    }
}
