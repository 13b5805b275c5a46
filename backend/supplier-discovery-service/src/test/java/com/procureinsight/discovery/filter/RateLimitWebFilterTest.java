package com.procureinsight.discovery.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.procureinsight.discovery.config.DiscoveryProperties;
import com.procureinsight.discovery.ratelimit.RateLimiterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimitWebFilterTest {

    private final AtomicInteger passed = new AtomicInteger();
    private final WebFilterChain chain = exchange -> {
        passed.incrementAndGet();
        return Mono.empty();
    };

    private RateLimitWebFilter filter;

    @BeforeEach
    void setUp() {
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.getRateLimit().setInboundMaxRequests(2);
        properties.getRateLimit().getInboundEndpointLimits().clear();
        filter = new RateLimitWebFilter(new RateLimiterRegistry(properties, Clock.systemUTC()),
                new ObjectMapper(), properties);
    }

    private static MockServerWebExchange exchange(String path, String userAgent) {
        return MockServerWebExchange.from(MockServerHttpRequest.post(path)
                .remoteAddress(new InetSocketAddress("10.0.0.1", 40000))
                .header("User-Agent", userAgent)
                .build());
    }

    @Test
    @DisplayName("requests over the limit get 429 with Retry-After and a JSON body")
    void rejectsOverLimit() {
        filter.filter(exchange("/api/v1/suppliers/discover", "curl"), chain).block();
        MockServerWebExchange second = exchange("/api/v1/suppliers/discover", "curl");
        filter.filter(second, chain).block();
        MockServerWebExchange third = exchange("/api/v1/suppliers/discover", "curl");

        filter.filter(third, chain).block();

        assertThat(passed).hasValue(2);
        assertThat(second.getResponse().getHeaders().getFirst("X-RateLimit-Remaining")).isEqualTo("0");
        assertThat(third.getResponse().getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(third.getResponse().getHeaders().getFirst("Retry-After")).isEqualTo("60");
        assertThat(third.getResponse().getBodyAsString().block())
                .contains("\"limit\":2")
                .contains("\"window\":60")
                .contains("\"retryAfter\":60");
    }

    @Test
    @DisplayName("callers and paths are limited independently")
    void keyedByCallerAndPath() {
        for (int i = 0; i < 2; i++) {
            filter.filter(exchange("/api/v1/suppliers/discover", "curl"), chain).block();
        }

        filter.filter(exchange("/api/v1/suppliers/discover", "Mozilla/5.0"), chain).block();
        filter.filter(exchange("/api/v1/market/intelligence", "curl"), chain).block();

        assertThat(passed).hasValue(4);
    }

    @Test
    @DisplayName("an endpoint with its own limit is admitted up to that limit")
    void endpointLimitOverridesDefault() {
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.getRateLimit().setInboundMaxRequests(2);
        RateLimitWebFilter perEndpoint = new RateLimitWebFilter(
                new RateLimiterRegistry(properties, Clock.systemUTC()), new ObjectMapper(), properties);

        for (int i = 0; i < 5; i++) {
            perEndpoint.filter(exchange("/api/v1/procurement/analyze", "curl"), chain).block();
        }
        MockServerWebExchange sixth = exchange("/api/v1/procurement/analyze", "curl");
        perEndpoint.filter(sixth, chain).block();
        for (int i = 0; i < 3; i++) {
            perEndpoint.filter(exchange("/api/v1/other", "curl"), chain).block();
        }

        assertThat(passed).hasValue(7);
        assertThat(sixth.getResponse().getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(sixth.getResponse().getBodyAsString().block()).contains("\"limit\":5");
    }

    @Test
    @DisplayName("health paths are never limited")
    void healthIsExempt() {
        for (int i = 0; i < 5; i++) {
            filter.filter(exchange("/api/v1/health", "probe"), chain).block();
        }

        assertThat(passed).hasValue(5);
    }
}
