package com.procureinsight.discovery.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Externalized tuning for the discovery pipeline.
 *
 * Every duration accepts the usual Spring Boot formats ({@code 500ms}, {@code 30m}, {@code PT5M}).
 */
@Configuration
@ConfigurationProperties(prefix = "discovery")
@Data
public class DiscoveryProperties {

    /**
     * Caller-level timeout for one discovery request, batches included
     */
    private Duration requestTimeout = Duration.ofSeconds(120);

    private CacheSettings cache = new CacheSettings();

    private RateLimitSettings rateLimit = new RateLimitSettings();

    private SearchSettings search = new SearchSettings();

    private EnrichmentSettings enrichment = new EnrichmentSettings();

    @Data
    public static class CacheSettings {
        /** Interval between background sweeps of expired entries */
        private Duration sweepInterval = Duration.ofMinutes(5);

        /** Consecutive sweep failures tolerated before the sweeper starts skipping cycles */
        private int sweepFailureThreshold = 3;

        /** Aggregated search results per (query, location) */
        private Duration searchTtl = Duration.ofMinutes(30);

        /** Enriched supplier records */
        private Duration supplierTtl = Duration.ofHours(6);

        /** Market intelligence syntheses */
        private Duration marketTtl = Duration.ofHours(2);
    }

    @Data
    public static class RateLimitSettings {
        /** Inbound sliding window per caller and path */
        private boolean inboundEnabled = true;
        private int inboundMaxRequests = 10;
        private Duration inboundWindow = Duration.ofSeconds(60);

        /** Per-path overrides of {@code inboundMaxRequests}, same window */
        private Map<String, Integer> inboundEndpointLimits = new LinkedHashMap<>(Map.of(
                "/api/v1/procurement/analyze", 5,
                "/api/v1/suppliers/discover", 10,
                "/api/v1/market/intelligence", 10,
                "/api/v1/market/trends", 10,
                "/api/v1/suppliers/suggestions", 20));

        /** Outbound token bucket per search provider */
        private int searchCapacity = 30;
        private double searchRefillPerSecond = 1.0;

        /** Outbound adaptive token bucket per language-model provider */
        private int llmBaseLimit = 10;
        private int llmMaxLimit = 100;
        private double llmRefillPerSecond = 2.0;
        private Duration llmAdjustmentInterval = Duration.ofSeconds(60);
    }

    @Data
    public static class SearchSettings {
        /** Results requested from the provider for each query variant */
        private int resultsPerVariant = 5;

        /** Pause between consecutive provider calls of one fan-out */
        private Duration paceDelay = Duration.ofSeconds(1);

        private Duration timeout = Duration.ofSeconds(30);

        /** Cap used by market searches */
        private int maxResults = 10;
    }

    @Data
    public static class EnrichmentSettings {
        private int batchSize = 5;

        /** Pause between enrichment batches */
        private Duration batchDelay = Duration.ofMillis(500);

        /** Per-provider completion timeout */
        private Duration providerTimeout = Duration.ofSeconds(30);
    }
}
