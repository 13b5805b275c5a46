package com.procureinsight.discovery.cache;

import com.procureinsight.discovery.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TtlCacheTest {

    private MutableClock clock;
    private TtlCache<Object> cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        cache = new TtlCache<>(clock);
    }

    @Nested
    @DisplayName("expiry")
    class Expiry {

        @Test
        @DisplayName("entry is a miss once its TTL has elapsed, even without a sweep")
        void expiredEntryIsMiss() {
            // given
            cache.set("k", "v", Duration.ofSeconds(1));

            // when
            clock.advance(Duration.ofMillis(1100));

            // then
            assertThat(cache.get("k")).isEmpty();
            assertThat(cache.size()).isZero();
        }

        @Test
        @DisplayName("entry is returned immediately after set")
        void freshEntryIsHit() {
            cache.set("k", "v", Duration.ofSeconds(100));

            assertThat(cache.get("k")).contains("v");
        }

        @Test
        @DisplayName("entry expires exactly at its expiry instant")
        void expiresAtBoundary() {
            cache.set("k", "v", Duration.ofSeconds(10));

            clock.advance(Duration.ofMillis(9999));
            assertThat(cache.get("k")).contains("v");

            clock.advance(Duration.ofMillis(1));
            assertThat(cache.get("k")).isEmpty();
        }

        @Test
        @DisplayName("re-set replaces the entry and its expiry")
        void resetReplacesEntry() {
            cache.set("k", "old", Duration.ofSeconds(1));
            cache.set("k", "new", Duration.ofSeconds(60));

            clock.advance(Duration.ofSeconds(2));

            assertThat(cache.get("k")).contains("new");
        }

        @Test
        @DisplayName("non-positive TTL is rejected")
        void rejectsNonPositiveTtl() {
            assertThatThrownBy(() -> cache.set("k", "v", Duration.ZERO))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("sweep removes only expired entries")
    void sweepRemovesExpired() {
        // given
        cache.set("short-1", "a", Duration.ofSeconds(5));
        cache.set("short-2", "b", Duration.ofSeconds(5));
        cache.set("long", "c", Duration.ofMinutes(5));

        // when
        clock.advance(Duration.ofSeconds(6));
        int removed = cache.sweep();

        // then
        assertThat(removed).isEqualTo(2);
        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.get("long")).contains("c");
    }

    @Test
    @DisplayName("delete reports whether an entry existed")
    void deleteReportsPresence() {
        cache.set("k", "v", Duration.ofMinutes(1));

        assertThat(cache.delete("k")).isTrue();
        assertThat(cache.delete("k")).isFalse();
    }

    @Test
    @DisplayName("invalidatePattern removes keys containing the fragment")
    void invalidatePattern() {
        cache.set("search:supplier:1", "a", Duration.ofMinutes(1));
        cache.set("search:market:2", "b", Duration.ofMinutes(1));
        cache.set("supplier:3", "c", Duration.ofMinutes(1));

        int removed = cache.invalidatePattern("search:");

        assertThat(removed).isEqualTo(2);
        assertThat(cache.get("supplier:3")).contains("c");
    }

    @Test
    @DisplayName("typed get treats a value of another type as a miss")
    void typedGet() {
        cache.set("k", 42, Duration.ofMinutes(1));

        assertThat(cache.get("k", Integer.class)).contains(42);
        assertThat(cache.get("k", String.class)).isEmpty();
    }

    @Test
    @DisplayName("statistics count hits, misses and entry ages")
    void statistics() {
        cache.set("a", "1", Duration.ofMinutes(1));
        clock.advance(Duration.ofSeconds(10));
        cache.set("b", "2", Duration.ofMinutes(1));

        cache.get("a");
        cache.get("b");
        cache.get("missing");

        CacheStats stats = cache.getStats();
        assertThat(stats.totalEntries()).isEqualTo(2);
        assertThat(stats.hitCount()).isEqualTo(2);
        assertThat(stats.missCount()).isEqualTo(1);
        assertThat(stats.errorCount()).isZero();
        assertThat(stats.hitRate()).isEqualTo(2.0 / 3.0);
        assertThat(stats.oldestEntryAge()).isEqualTo(Duration.ofSeconds(10));
        assertThat(stats.newestEntryAge()).isEqualTo(Duration.ZERO);
    }

    @Nested
    @DisplayName("getOrCompute")
    class GetOrCompute {

        @Test
        @DisplayName("loader runs once, later calls are served from the cache")
        void loadsOnce() {
            AtomicInteger loads = new AtomicInteger();

            for (int i = 0; i < 3; i++) {
                StepVerifier.create(cache.getOrCompute("k", String.class, Duration.ofMinutes(1),
                                () -> Mono.fromSupplier(() -> "value-" + loads.incrementAndGet())))
                        .expectNext("value-1")
                        .verifyComplete();
            }

            assertThat(loads).hasValue(1);
        }

        @Test
        @DisplayName("values rejected by the predicate are not stored")
        void skipsUncacheableValues() {
            AtomicInteger loads = new AtomicInteger();

            for (int i = 0; i < 2; i++) {
                StepVerifier.create(cache.getOrCompute("k", String.class, Duration.ofMinutes(1),
                                () -> Mono.fromSupplier(() -> "" + loads.incrementAndGet()).map(v -> ""),
                                value -> !value.isEmpty()))
                        .expectNext("")
                        .verifyComplete();
            }

            assertThat(loads).hasValue(2);
            assertThat(cache.size()).isZero();
        }

        @Test
        @DisplayName("loader errors propagate and are not cached")
        void errorsAreNotCached() {
            StepVerifier.create(cache.getOrCompute("k", String.class, Duration.ofMinutes(1),
                            () -> Mono.error(new IllegalStateException("provider down"))))
                    .expectErrorMessage("provider down")
                    .verify();

            assertThat(cache.get("k")).isEmpty();
        }
    }

    @Test
    @DisplayName("concurrent writers and readers never corrupt the map")
    void concurrentAccess() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        String key = "k-" + thread + "-" + i;
                        cache.set(key, i, Duration.ofMinutes(1));
                        assertThat(cache.get(key)).contains(i);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(cache.size()).isEqualTo(8 * 500);
        assertThat(cache.getHitCount()).isEqualTo(8 * 500);
    }
}
