package com.procureinsight.discovery.ratelimit;

import com.procureinsight.discovery.config.DiscoveryProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The limiters of the process, one per call site.
 *
 * <ul>
 *   <li>{@code inbound}: sliding window per caller and path, with per-endpoint overrides</li>
 *   <li>{@code search}: token bucket per search provider</li>
 *   <li>{@code llm}: adaptive token bucket per language-model provider</li>
 * </ul>
 */
@Component
@Slf4j
public class RateLimiterRegistry {

    public static final String INBOUND = "inbound";
    public static final String SEARCH = "search";
    public static final String LLM = "llm";

    private final SlidingWindowRateLimiter inbound;
    private final Map<String, SlidingWindowRateLimiter> inboundEndpoints = new LinkedHashMap<>();
    private final TokenBucketRateLimiter search;
    private final AdaptiveRateLimiter llm;

    public RateLimiterRegistry(DiscoveryProperties properties, Clock clock) {
        DiscoveryProperties.RateLimitSettings settings = properties.getRateLimit();
        this.inbound = new SlidingWindowRateLimiter(INBOUND,
                settings.getInboundMaxRequests(), settings.getInboundWindow(), clock);
        settings.getInboundEndpointLimits().forEach((path, limit) -> inboundEndpoints.put(path,
                new SlidingWindowRateLimiter(INBOUND + ":" + path, limit, settings.getInboundWindow(), clock)));
        this.search = new TokenBucketRateLimiter(SEARCH,
                settings.getSearchCapacity(), settings.getSearchRefillPerSecond(), clock);
        this.llm = new AdaptiveRateLimiter(
                new TokenBucketRateLimiter(LLM, settings.getLlmBaseLimit(), settings.getLlmRefillPerSecond(), clock),
                settings.getLlmBaseLimit(), settings.getLlmMaxLimit(), settings.getLlmAdjustmentInterval(), clock);
    }

    public SlidingWindowRateLimiter inbound() {
        return inbound;
    }

    /**
     * The inbound limiter for a request path: the endpoint override when one is configured,
     * the default window otherwise.
     */
    public SlidingWindowRateLimiter inbound(String path) {
        return inboundEndpoints.getOrDefault(path, inbound);
    }

    public Map<String, Integer> inboundEndpointLimits() {
        Map<String, Integer> limits = new LinkedHashMap<>();
        inboundEndpoints.forEach((path, limiter) -> limits.put(path, limiter.getLimit()));
        return limits;
    }

    public TokenBucketRateLimiter search() {
        return search;
    }

    public AdaptiveRateLimiter llm() {
        return llm;
    }

    public Map<String, RateLimiter> all() {
        Map<String, RateLimiter> limiters = new LinkedHashMap<>();
        limiters.put(INBOUND, inbound);
        limiters.put(SEARCH, search);
        limiters.put(LLM, llm);
        return limiters;
    }

    @Scheduled(fixedDelayString = "${discovery.rate-limit.inbound-window:PT60S}")
    public void evictIdleWindows() {
        int removed = inbound.evictIdle();
        for (SlidingWindowRateLimiter endpoint : inboundEndpoints.values()) {
            removed += endpoint.evictIdle();
        }
        if (removed > 0) {
            log.debug("Evicted {} idle inbound rate-limit windows", removed);
        }
    }
}
