package com.procureinsight.discovery.filter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.procureinsight.discovery.config.DiscoveryProperties;
import com.procureinsight.discovery.ratelimit.RateLimitDecision;
import com.procureinsight.discovery.ratelimit.RateLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Inbound admission control per caller (client address and user agent) and path. Each
 * endpoint may carry its own limit; other paths share the default window.
 *
 * Rejected requests get a 429 with a {@code Retry-After} header and a JSON body carrying
 * the limit, the window and the retry delay. Health and actuator paths are never limited.
 */
@Component
@Slf4j
public class RateLimitWebFilter implements WebFilter, Ordered {

    private static final List<String> EXEMPT_PREFIXES = List.of("/api/v1/health", "/actuator");

    private final RateLimiterRegistry rateLimiters;
    private final ObjectMapper objectMapper;
    private final boolean enabled;

    public RateLimitWebFilter(RateLimiterRegistry rateLimiters, ObjectMapper objectMapper,
                              DiscoveryProperties properties) {
        this.rateLimiters = rateLimiters;
        this.objectMapper = objectMapper;
        this.enabled = properties.getRateLimit().isInboundEnabled();
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        if (!enabled || EXEMPT_PREFIXES.stream().anyMatch(path::startsWith)) {
            return chain.filter(exchange);
        }

        String key = clientKey(exchange.getRequest()) + ":" + path;
        RateLimitDecision decision = rateLimiters.inbound(path).tryAcquire(key);
        if (decision.allowed()) {
            exchange.getResponse().getHeaders().set("X-RateLimit-Limit", String.valueOf(decision.limit()));
            exchange.getResponse().getHeaders().set("X-RateLimit-Remaining", String.valueOf(decision.remaining()));
            return chain.filter(exchange);
        }

        log.warn("Rate limit exceeded for {} on {}", clientKey(exchange.getRequest()), path);
        return reject(exchange.getResponse(), decision);
    }

    static String clientKey(ServerHttpRequest request) {
        InetSocketAddress remote = request.getRemoteAddress();
        String address = remote != null && remote.getAddress() != null
                ? remote.getAddress().getHostAddress()
                : "unknown";
        String userAgent = request.getHeaders().getFirst(HttpHeaders.USER_AGENT);
        return address + ":" + Integer.toHexString(userAgent == null ? 0 : userAgent.hashCode());
    }

    private Mono<Void> reject(ServerHttpResponse response, RateLimitDecision decision) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Rate limit exceeded");
        body.put("status", HttpStatus.TOO_MANY_REQUESTS.value());
        body.put("limit", decision.limit());
        body.put("window", decision.window().toSeconds());
        body.put("retryAfter", decision.retryAfterSeconds());

        response.setStatusCode(HttpStatus.TOO_MANY_REQUESTS);
        response.getHeaders().set(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);

        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize rate limit body: {}", e.getOriginalMessage());
            bytes = "{\"error\":\"Rate limit exceeded\"}".getBytes(StandardCharsets.UTF_8);
        }
        DataBuffer buffer = response.bufferFactory().wrap(bytes);
        return response.writeWith(Mono.just(buffer));
    }

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE + 10;
    }
}
