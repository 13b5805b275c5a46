package com.procureinsight.discovery.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sliding window of admitted timestamps per key.
 *
 * Timestamps older than {@code now - window} are dropped before each check, so the number of
 * admissions in any trailing window never exceeds the limit.
 */
public class SlidingWindowRateLimiter implements RateLimiter {

    private final String name;
    private final Duration window;
    private final Clock clock;
    private final Map<String, Deque<Instant>> windows = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private volatile int maxRequests;

    public SlidingWindowRateLimiter(String name, int maxRequests, Duration window, Clock clock) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be at least 1");
        }
        this.name = name;
        this.maxRequests = maxRequests;
        this.window = window;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public RateLimitDecision tryAcquire(String key, int permits) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(window);
        lock.lock();
        try {
            Deque<Instant> timestamps = windows.computeIfAbsent(key, k -> new ArrayDeque<>());
            while (!timestamps.isEmpty() && timestamps.peekFirst().isBefore(cutoff)) {
                timestamps.pollFirst();
            }
            int limit = maxRequests;
            if (timestamps.size() + permits <= limit) {
                for (int i = 0; i < permits; i++) {
                    timestamps.addLast(now);
                }
                return RateLimitDecision.allow(limit, window, limit - timestamps.size());
            }
            Instant oldest = timestamps.isEmpty() ? now : timestamps.peekFirst();
            return RateLimitDecision.reject(limit, window, Duration.between(now, oldest.plus(window)));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getLimit() {
        return maxRequests;
    }

    @Override
    public Duration getWindow() {
        return window;
    }

    @Override
    public void updateLimit(int newLimit) {
        maxRequests = Math.max(1, newLimit);
    }

    @Override
    public int occupancy(String key) {
        Instant cutoff = clock.instant().minus(window);
        lock.lock();
        try {
            Deque<Instant> timestamps = windows.get(key);
            if (timestamps == null) {
                return 0;
            }
            int count = 0;
            for (Instant ts : timestamps) {
                if (!ts.isBefore(cutoff)) count++;
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int activeKeys() {
        lock.lock();
        try {
            return windows.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops keys whose whole window has expired.
     */
    public int evictIdle() {
        Instant cutoff = clock.instant().minus(window);
        int removed = 0;
        lock.lock();
        try {
            Iterator<Deque<Instant>> it = windows.values().iterator();
            while (it.hasNext()) {
                Deque<Instant> timestamps = it.next();
                if (timestamps.isEmpty() || timestamps.peekLast().isBefore(cutoff)) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        return removed;
    }
}
