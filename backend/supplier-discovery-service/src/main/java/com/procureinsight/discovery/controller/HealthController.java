package com.procureinsight.discovery.controller;

import com.procureinsight.discovery.cache.CacheStats;
import com.procureinsight.discovery.cache.TtlCache;
import com.procureinsight.discovery.dto.HealthResponse;
import com.procureinsight.discovery.llm.LlmProviderChain;
import com.procureinsight.discovery.ratelimit.RateLimiter;
import com.procureinsight.discovery.ratelimit.RateLimiterRegistry;
import com.procureinsight.discovery.search.SearchProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health and statistics for the cache, the rate limiters and the external providers.
 */
@RestController
@RequestMapping("/api/v1/health")
@Slf4j
public class HealthController {

    static final String VERSION = "1.0.0";

    /** Cache errors at or above this count mark the service unhealthy */
    static final long CACHE_ERROR_THRESHOLD = 10;

    private final TtlCache<Object> cache;
    private final RateLimiterRegistry rateLimiters;
    private final SearchProvider searchProvider;
    private final LlmProviderChain providerChain;
    private final Clock clock;
    private final Instant startedAt;

    public HealthController(TtlCache<Object> cache, RateLimiterRegistry rateLimiters, SearchProvider searchProvider,
                            LlmProviderChain providerChain, Clock clock) {
        this.cache = cache;
        this.rateLimiters = rateLimiters;
        this.searchProvider = searchProvider;
        this.providerChain = providerChain;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    @GetMapping
    public ResponseEntity<HealthResponse> getHealth() {
        Map<String, String> services = new LinkedHashMap<>();
        services.put("cache", cache.getErrorCount() < CACHE_ERROR_THRESHOLD ? "healthy" : "unhealthy");
        services.put("search", searchProvider.isAvailable() ? "healthy" : "unconfigured");
        services.put("llm", providerChain.getAvailableProviders().isEmpty() ? "unconfigured" : "healthy");

        // missing credentials degrade results but do not make the service unhealthy
        boolean healthy = !"unhealthy".equals(services.get("cache"));

        HealthResponse response = HealthResponse.builder()
                .status(healthy ? "healthy" : "unhealthy")
                .version(VERSION)
                .timestamp(LocalDateTime.now(clock))
                .services(services)
                .uptime(Duration.between(startedAt, clock.instant()).toMillis() / 1000.0)
                .build();
        return ResponseEntity.ok(response);
    }

    @GetMapping("/cache")
    public ResponseEntity<Map<String, Object>> getCacheHealth() {
        CacheStats stats = cache.getStats();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("totalEntries", stats.totalEntries());
        body.put("hitCount", stats.hitCount());
        body.put("missCount", stats.missCount());
        body.put("errorCount", stats.errorCount());
        body.put("hitRate", stats.hitRate());
        body.put("oldestEntryAgeSeconds", stats.oldestEntryAge() == null ? null : stats.oldestEntryAge().toSeconds());
        body.put("newestEntryAgeSeconds", stats.newestEntryAge() == null ? null : stats.newestEntryAge().toSeconds());
        return ResponseEntity.ok(body);
    }

    /**
     * Drops every cache entry and resets the counters.
     */
    @PostMapping("/cache/clear")
    public ResponseEntity<Map<String, Object>> clearCache() {
        int entries = cache.size();
        cache.clear();
        cache.resetStats();
        log.info("Cache cleared ({} entries)", entries);
        return ResponseEntity.ok(Map.of(
                "message", "Cache cleared successfully",
                "clearedEntries", entries,
                "timestamp", LocalDateTime.now(clock).toString()));
    }

    @GetMapping("/rate-limits")
    public ResponseEntity<Map<String, Object>> getRateLimits() {
        Map<String, Object> body = new LinkedHashMap<>();
        for (Map.Entry<String, RateLimiter> entry : rateLimiters.all().entrySet()) {
            RateLimiter limiter = entry.getValue();
            Map<String, Object> state = new LinkedHashMap<>();
            state.put("limit", limiter.getLimit());
            state.put("windowSeconds", limiter.getWindow().toSeconds());
            state.put("activeKeys", limiter.activeKeys());
            body.put(entry.getKey(), state);
        }
        body.put("inboundEndpoints", rateLimiters.inboundEndpointLimits());

        Map<String, Integer> occupancy = new LinkedHashMap<>();
        occupancy.put(searchProvider.getName(), rateLimiters.search().occupancy(searchProvider.getName()));
        for (String provider : providerChain.getAvailableProviders()) {
            occupancy.put(provider, rateLimiters.llm().occupancy(provider));
        }
        body.put("providerOccupancy", occupancy);
        return ResponseEntity.ok(body);
    }
}
