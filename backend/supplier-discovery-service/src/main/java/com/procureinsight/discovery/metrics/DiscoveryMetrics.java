package com.procureinsight.discovery.metrics;

import com.procureinsight.discovery.cache.TtlCache;
import com.procureinsight.discovery.ratelimit.RateLimiter;
import com.procureinsight.discovery.ratelimit.RateLimiterRegistry;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Exposes cache and rate limiter state to Micrometer.
 */
@Component
@RequiredArgsConstructor
public class DiscoveryMetrics implements MeterBinder {

    private final TtlCache<Object> cache;
    private final RateLimiterRegistry rateLimiters;

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder("discovery.cache.entries", cache, TtlCache::size)
                .description("Live cache entries")
                .register(registry);
        FunctionCounter.builder("discovery.cache.hits", cache, TtlCache::getHitCount)
                .register(registry);
        FunctionCounter.builder("discovery.cache.misses", cache, TtlCache::getMissCount)
                .register(registry);
        FunctionCounter.builder("discovery.cache.errors", cache, TtlCache::getErrorCount)
                .register(registry);

        for (Map.Entry<String, RateLimiter> entry : rateLimiters.all().entrySet()) {
            RateLimiter limiter = entry.getValue();
            Gauge.builder("discovery.ratelimit.limit", limiter, RateLimiter::getLimit)
                    .tag("limiter", entry.getKey())
                    .register(registry);
            Gauge.builder("discovery.ratelimit.active.keys", limiter, RateLimiter::activeKeys)
                    .tag("limiter", entry.getKey())
                    .register(registry);
        }
    }
}
