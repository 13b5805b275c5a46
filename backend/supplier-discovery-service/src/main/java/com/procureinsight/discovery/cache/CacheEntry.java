package com.procureinsight.discovery.cache;

import java.time.Instant;

/**
 * One cached value with its absolute expiry. Replaced wholesale on re-set, never mutated.
 */
public record CacheEntry<V>(String key, V value, Instant expiresAt, Instant createdAt) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
