package com.procureinsight.discovery.llm;

import com.procureinsight.discovery.config.DiscoveryProperties;
import com.procureinsight.discovery.exception.EnrichmentFailureException;
import com.procureinsight.discovery.exception.RateLimitExceededException;
import com.procureinsight.discovery.ratelimit.AdaptiveRateLimiter;
import com.procureinsight.discovery.ratelimit.RateLimitDecision;
import com.procureinsight.discovery.ratelimit.RateLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Ordered language-model providers behind a single completion call.
 *
 * Providers are tried in order; the first non-empty completion wins. Each attempt goes
 * through the adaptive {@code llm} limiter and a per-provider timeout, and its outcome feeds
 * the limiter's error ratio. When every provider fails the result is an
 * {@link EnrichmentFailureException}.
 */
@Service
@Slf4j
public class LlmProviderChain {

    private final List<LlmProvider> providers;
    private final AdaptiveRateLimiter limiter;
    private final Duration providerTimeout;

    public LlmProviderChain(List<LlmProvider> providers, RateLimiterRegistry rateLimiters,
                            DiscoveryProperties properties) {
        this.providers = List.copyOf(providers);
        this.limiter = rateLimiters.llm();
        this.providerTimeout = properties.getEnrichment().getProviderTimeout();
    }

    public Mono<ProviderResponse> complete(String prompt) {
        return Mono.defer(() -> {
            List<LlmProvider> enabled = providers.stream().filter(LlmProvider::isEnabled).toList();
            if (enabled.isEmpty()) {
                return Mono.error(new EnrichmentFailureException("No language-model provider is configured"));
            }
            return tryProvidersInSequence(enabled, 0, prompt, null);
        });
    }

    public List<String> getAvailableProviders() {
        return providers.stream().filter(LlmProvider::isEnabled).map(LlmProvider::getName).toList();
    }

    private Mono<ProviderResponse> tryProvidersInSequence(List<LlmProvider> chain, int index, String prompt,
                                                          Throwable lastError) {
        if (index >= chain.size()) {
            log.warn("All language-model providers failed");
            return Mono.error(new EnrichmentFailureException("All language-model providers failed", lastError));
        }

        LlmProvider current = chain.get(index);
        RateLimitDecision decision = limiter.tryAcquire(current.getName());
        if (!decision.allowed()) {
            log.warn("Provider {} is rate limited (retry after {}ms). Trying next provider...",
                    current.getName(), decision.retryAfter().toMillis());
            return tryProvidersInSequence(chain, index + 1, prompt,
                    new RateLimitExceededException(current.getName(), decision));
        }

        log.debug("Attempting provider: {} (attempt {}/{})", current.getName(), index + 1, chain.size());

        return current.complete(prompt)
                .timeout(providerTimeout)
                .map(text -> new ProviderResponse(current.getName(), text))
                .doOnNext(response -> limiter.recordSuccess())
                .onErrorResume(e -> {
                    limiter.recordError();
                    log.warn("Provider {} failed: {}. Trying next provider...", current.getName(), e.getMessage());
                    return tryProvidersInSequence(chain, index + 1, prompt, e);
                })
                .switchIfEmpty(Mono.defer(() -> {
                    limiter.recordError();
                    log.warn("Provider {} returned empty response. Trying next provider...", current.getName());
                    return tryProvidersInSequence(chain, index + 1, prompt, lastError);
                }));
    }
}
