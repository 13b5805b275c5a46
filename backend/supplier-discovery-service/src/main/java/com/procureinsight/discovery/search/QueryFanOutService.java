package com.procureinsight.discovery.search;

import com.procureinsight.discovery.cache.CacheKeys;
import com.procureinsight.discovery.cache.TtlCache;
import com.procureinsight.discovery.config.DiscoveryProperties;
import com.procureinsight.discovery.ratelimit.RateLimitDecision;
import com.procureinsight.discovery.ratelimit.RateLimiter;
import com.procureinsight.discovery.ratelimit.RateLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs query variants against the search provider and aggregates the results.
 *
 * Variants are issued one at a time, in order, with the pacing policy between consecutive
 * calls. A failing or rate-limited variant contributes nothing and the remaining variants
 * still run, so the fan-out never fails as a whole.
 */
@Service
@Slf4j
public class QueryFanOutService {

    private final SearchProvider searchProvider;
    private final SearchAggregator aggregator;
    private final QueryVariantBuilder variantBuilder;
    private final TtlCache<Object> cache;
    private final RateLimiter searchLimiter;
    private final PacingPolicy pacing;
    private final DiscoveryProperties.SearchSettings settings;
    private final Duration searchTtl;

    public QueryFanOutService(SearchProvider searchProvider,
                              SearchAggregator aggregator,
                              QueryVariantBuilder variantBuilder,
                              TtlCache<Object> cache,
                              RateLimiterRegistry rateLimiters,
                              @Qualifier("searchPacing") PacingPolicy pacing,
                              DiscoveryProperties properties) {
        this.searchProvider = searchProvider;
        this.aggregator = aggregator;
        this.variantBuilder = variantBuilder;
        this.cache = cache;
        this.searchLimiter = rateLimiters.search();
        this.pacing = pacing;
        this.settings = properties.getSearch();
        this.searchTtl = properties.getCache().getSearchTtl();
    }

    public Mono<List<SearchHit>> searchSuppliers(String query, String location, int maxResults) {
        String key = CacheKeys.searchKey(SearchKind.SUPPLIER.cacheSegment(), query, location);
        return fanOut(key, variantBuilder.supplierVariants(query, location), query, SearchKind.SUPPLIER)
                .map(results -> results.top(maxResults));
    }

    public Mono<List<SearchHit>> searchMarket(String product, String timeframe) {
        String key = CacheKeys.searchKey(SearchKind.MARKET.cacheSegment(), product, timeframe);
        return fanOut(key, variantBuilder.marketVariants(product, timeframe), product, SearchKind.MARKET)
                .map(results -> results.top(settings.getMaxResults()));
    }

    /**
     * One query, no variants. Used for market enrichment lookups.
     */
    public Mono<List<SearchHit>> searchGeneral(String query, int maxResults) {
        String key = CacheKeys.searchKey(SearchKind.GENERAL.cacheSegment(), query, String.valueOf(maxResults));
        return cache.getOrCompute(key, AggregatedResults.class, searchTtl,
                        () -> executeVariant(QueryVariantBuilder.cleanQuery(query), maxResults)
                                .map(hits -> new AggregatedResults(aggregator.rank(stampOrder(hits), query))),
                        results -> !results.isEmpty())
                .map(results -> results.top(maxResults));
    }

    private Mono<AggregatedResults> fanOut(String cacheKey, List<String> variants, String originalQuery, SearchKind kind) {
        return cache.getOrCompute(cacheKey, AggregatedResults.class, searchTtl,
                () -> runVariants(variants)
                        .map(raw -> {
                            List<SearchHit> aggregated = aggregator.aggregate(raw, originalQuery, kind);
                            log.info("Fan-out for '{}' ({}): {} raw hits, {} after aggregation",
                                    originalQuery, kind, raw.size(), aggregated.size());
                            return new AggregatedResults(aggregated);
                        }),
                results -> !results.isEmpty());
    }

    /**
     * Issues every variant in order, pausing between calls, and concatenates the hits.
     */
    Mono<List<SearchHit>> runVariants(List<String> variants) {
        return Flux.range(0, variants.size())
                .concatMap(i -> (i == 0 ? Mono.<Void>empty() : pacing.pause())
                        .then(executeVariant(variants.get(i), settings.getResultsPerVariant())))
                .concatMapIterable(hits -> hits)
                .collectList()
                .map(this::stampOrder);
    }

    private Mono<List<SearchHit>> executeVariant(String query, int maxResults) {
        return Mono.defer(() -> {
            RateLimitDecision decision = searchLimiter.tryAcquire(searchProvider.getName());
            if (!decision.allowed()) {
                log.warn("Search rate limit reached, skipping '{}' (retry after {}ms)",
                        query, decision.retryAfter().toMillis());
                return Mono.just(List.<SearchHit>of());
            }
            log.info("Searching: {}", query);
            return searchProvider.search(query, maxResults)
                    .defaultIfEmpty(List.of())
                    .onErrorResume(e -> {
                        log.error("Search failed for query '{}': {}", query, e.getMessage());
                        return Mono.just(List.of());
                    });
        });
    }

    private List<SearchHit> stampOrder(List<SearchHit> hits) {
        List<SearchHit> ordered = new ArrayList<>(hits.size());
        for (int i = 0; i < hits.size(); i++) {
            ordered.add(hits.get(i).toBuilder().discoveryOrder(i).build());
        }
        return ordered;
    }

    public List<String> suggestions(String query) {
        return variantBuilder.suggestions(query);
    }
}
