package com.procureinsight.discovery.cache;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * In-memory key/value cache with per-entry TTL.
 *
 * All map access goes through one lock. Expiry is enforced lazily on every read, so an entry
 * is never returned after its TTL even if {@link #sweep()} has not run yet. The periodic
 * sweep only reclaims memory.
 */
@Slf4j
public class TtlCache<V> {

    private final Map<String, CacheEntry<V>> entries = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;

    private final AtomicLong hitCount = new AtomicLong();
    private final AtomicLong missCount = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();

    public TtlCache(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Optional<V> get(String key) {
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                missCount.incrementAndGet();
                return Optional.empty();
            }
            if (entry.isExpired(clock.instant())) {
                entries.remove(key);
                missCount.incrementAndGet();
                return Optional.empty();
            }
            hitCount.incrementAndGet();
            return Optional.of(entry.value());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Typed read. A value of another type counts as a miss.
     */
    public <T extends V> Optional<T> get(String key, Class<T> type) {
        return get(key).filter(type::isInstance).map(type::cast);
    }

    public void set(String key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive: " + ttl);
        }
        Instant now = clock.instant();
        lock.lock();
        try {
            entries.put(key, new CacheEntry<>(key, value, now.plus(ttl), now));
        } finally {
            lock.unlock();
        }
    }

    public boolean delete(String key) {
        lock.lock();
        try {
            return entries.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every entry whose expiry is at or before now.
     *
     * @return number of removed entries
     */
    public int sweep() {
        Instant now = clock.instant();
        int removed = 0;
        lock.lock();
        try {
            Iterator<CacheEntry<V>> it = entries.values().iterator();
            while (it.hasNext()) {
                if (it.next().isExpired(now)) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        return removed;
    }

    /**
     * Removes entries whose key contains the given fragment.
     */
    public int invalidatePattern(String fragment) {
        int removed = 0;
        lock.lock();
        try {
            Iterator<String> it = entries.keySet().iterator();
            while (it.hasNext()) {
                if (it.next().contains(fragment)) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        return removed;
    }

    /**
     * Returns the cached value or subscribes to the loader and caches what it emits.
     * Loader errors propagate and are never cached.
     */
    public <T extends V> Mono<T> getOrCompute(String key, Class<T> type, Duration ttl, Supplier<Mono<T>> loader) {
        return getOrCompute(key, type, ttl, loader, value -> true);
    }

    /**
     * Same as {@link #getOrCompute(String, Class, Duration, Supplier)} but only values accepted
     * by {@code cacheable} are stored.
     */
    public <T extends V> Mono<T> getOrCompute(String key, Class<T> type, Duration ttl,
                                              Supplier<Mono<T>> loader, Predicate<? super T> cacheable) {
        return Mono.defer(() -> {
            Optional<T> cached = lookupQuietly(key).filter(type::isInstance).map(type::cast);
            if (cached.isPresent()) {
                log.debug("Cache HIT: {}", key);
                return Mono.just(cached.get());
            }
            log.debug("Cache MISS: {}", key);
            return loader.get()
                    .doOnNext(value -> {
                        if (cacheable.test(value)) {
                            storeQuietly(key, value, ttl);
                        }
                    });
        });
    }

    /**
     * Read that never throws. Internal failures count as errors and fall through to a miss.
     */
    public Optional<V> lookupQuietly(String key) {
        try {
            return get(key);
        } catch (RuntimeException e) {
            errorCount.incrementAndGet();
            log.warn("Error reading from cache: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public void storeQuietly(String key, V value, Duration ttl) {
        try {
            set(key, value, ttl);
        } catch (RuntimeException e) {
            errorCount.incrementAndGet();
            log.warn("Error writing to cache: {}", e.getMessage());
        }
    }

    public void recordError() {
        errorCount.incrementAndGet();
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public long getHitCount() {
        return hitCount.get();
    }

    public long getMissCount() {
        return missCount.get();
    }

    public long getErrorCount() {
        return errorCount.get();
    }

    public CacheStats getStats() {
        Instant now = clock.instant();
        lock.lock();
        try {
            Instant oldest = null;
            Instant newest = null;
            for (CacheEntry<V> entry : entries.values()) {
                if (oldest == null || entry.createdAt().isBefore(oldest)) oldest = entry.createdAt();
                if (newest == null || entry.createdAt().isAfter(newest)) newest = entry.createdAt();
            }
            return new CacheStats(
                    entries.size(),
                    hitCount.get(),
                    missCount.get(),
                    errorCount.get(),
                    oldest == null ? null : Duration.between(oldest, now),
                    newest == null ? null : Duration.between(newest, now)
            );
        } finally {
            lock.unlock();
        }
    }

    public void resetStats() {
        hitCount.set(0);
        missCount.set(0);
        errorCount.set(0);
    }
}
