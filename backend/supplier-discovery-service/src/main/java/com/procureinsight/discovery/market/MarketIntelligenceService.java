package com.procureinsight.discovery.market;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.procureinsight.discovery.cache.CacheKeys;
import com.procureinsight.discovery.cache.TtlCache;
import com.procureinsight.discovery.config.DiscoveryProperties;
import com.procureinsight.discovery.llm.JsonPayloadExtractor;
import com.procureinsight.discovery.llm.LlmProviderChain;
import com.procureinsight.discovery.search.PacingPolicy;
import com.procureinsight.discovery.search.QueryFanOutService;
import com.procureinsight.discovery.search.SearchHit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Market pricing and trend intelligence.
 *
 * Runs the market fan-out plus a set of targeted enrichment searches, then asks the
 * language-model chain to synthesize a {@link MarketIntelligence}. Any failure along the way
 * produces the deterministic fallback; only provider syntheses are cached.
 */
@Service
@Slf4j
public class MarketIntelligenceService {

    static final int ENRICHMENT_RESULTS = 3;
    static final int SUMMARY_LIMIT = 10;

    private final QueryFanOutService fanOutService;
    private final LlmProviderChain providerChain;
    private final JsonPayloadExtractor payloadExtractor;
    private final ObjectMapper objectMapper;
    private final TtlCache<Object> cache;
    private final PacingPolicy pacing;
    private final Duration marketTtl;
    private final Duration requestTimeout;

    public MarketIntelligenceService(QueryFanOutService fanOutService,
                                     LlmProviderChain providerChain,
                                     JsonPayloadExtractor payloadExtractor,
                                     ObjectMapper objectMapper,
                                     TtlCache<Object> cache,
                                     @Qualifier("searchPacing") PacingPolicy pacing,
                                     DiscoveryProperties properties) {
        this.fanOutService = fanOutService;
        this.providerChain = providerChain;
        this.payloadExtractor = payloadExtractor;
        this.objectMapper = objectMapper;
        this.cache = cache;
        this.pacing = pacing;
        this.marketTtl = properties.getCache().getMarketTtl();
        this.requestTimeout = properties.getRequestTimeout();
    }

    public Mono<MarketIntelligence> analyze(String product, Timeframe timeframe, String region) {
        String key = CacheKeys.marketKey(product, timeframe.getValue(), region);
        return cache.getOrCompute(key, MarketIntelligence.class, marketTtl,
                        () -> gatherMarketData(product, timeframe, region)
                                .flatMap(data -> synthesize(data, product, timeframe, region)),
                        intelligence -> !intelligence.isFallback())
                .timeout(requestTimeout)
                .onErrorResume(e -> {
                    if (e instanceof TimeoutException) {
                        log.warn("Market analysis for '{}' timed out after {}", product, requestTimeout);
                    } else {
                        log.error("Market analysis failed for '{}': {}", product, e.getMessage(), e);
                    }
                    return Mono.just(fallback(product, timeframe, region, List.of()));
                });
    }

    /**
     * Market fan-out followed by the enrichment searches, in order.
     */
    Mono<List<SearchHit>> gatherMarketData(String product, Timeframe timeframe, String region) {
        List<String> queries = enrichmentQueries(product, region);
        Mono<List<SearchHit>> enrichment = Flux.fromIterable(queries)
                .concatMap(query -> pacing.pause().then(fanOutService.searchGeneral(query, ENRICHMENT_RESULTS)))
                .concatMapIterable(hits -> hits)
                .collectList();

        return fanOutService.searchMarket(product, timeframe.getValue())
                .zipWith(enrichment, (base, extra) -> {
                    List<SearchHit> all = new ArrayList<>(base);
                    all.addAll(extra);
                    log.info("Gathered {} market data points for '{}' ({} from enrichment searches)",
                            all.size(), product, extra.size());
                    return all;
                });
    }

    static List<String> enrichmentQueries(String product, String region) {
        List<String> queries = new ArrayList<>(List.of(
                product + " supply chain analysis",
                product + " raw material costs",
                product + " demand forecast",
                product + " industry challenges",
                product + " regulatory impact"));
        if (region != null && !region.isBlank()) {
            queries.add(product + " " + region.trim() + " market analysis");
            queries.add(product + " " + region.trim() + " suppliers");
        }
        return queries;
    }

    private Mono<MarketIntelligence> synthesize(List<SearchHit> data, String product, Timeframe timeframe, String region) {
        List<String> sources = data.stream()
                .map(SearchHit::getSource)
                .filter(source -> source != null && !source.isBlank())
                .collect(LinkedHashSet<String>::new, LinkedHashSet::add, LinkedHashSet::addAll)
                .stream().toList();

        if (data.isEmpty()) {
            log.warn("No market data found for '{}'", product);
            return Mono.just(fallback(product, timeframe, region, sources));
        }

        return providerChain.complete(buildPrompt(data, product))
                .map(response -> toIntelligence(payloadExtractor.extract(response.text()), product, timeframe, region)
                        .toBuilder()
                        .dataPoints(data.size())
                        .dataSources(sources)
                        .generatedBy(response.provider())
                        .build())
                .onErrorResume(e -> {
                    log.warn("Market synthesis failed for '{}': {}", product, e.getMessage());
                    return Mono.just(fallback(product, timeframe, region, sources).toBuilder()
                            .dataPoints(data.size())
                            .build());
                });
    }

    String buildPrompt(List<SearchHit> data, String product) {
        return """
                Analyze the following market data for %s and provide comprehensive market intelligence:

                Market Data: %s

                Please provide a JSON response with the following structure:
                {
                    "price_insights": {
                        "price_range": {"min": 0, "max": 0, "avg": 0},
                        "currency": "USD",
                        "unit": "per unit/kg/etc",
                        "trend": "increasing/decreasing/stable",
                        "factors": ["factor1", "factor2"]
                    },
                    "market_trends": [
                        {
                            "trend_type": "pricing/demand/supply/technology",
                            "description": "trend description",
                            "impact": "high/medium/low",
                            "confidence": 0.0-1.0
                        }
                    ],
                    "market_size": "market size information",
                    "growth_rate": "growth rate percentage",
                    "key_players": ["company1", "company2"],
                    "opportunities": ["opportunity1", "opportunity2"],
                    "risks": ["risk1", "risk2"],
                    "recommendations": ["recommendation1", "recommendation2"]
                }

                Focus on:
                1. Price trends and forecasts
                2. Market dynamics and drivers
                3. Competitive landscape
                4. Supply chain insights
                5. Procurement recommendations
                """.formatted(product, summarize(data));
    }

    private String summarize(List<SearchHit> data) {
        List<Map<String, String>> items = new ArrayList<>();
        for (SearchHit hit : data.subList(0, Math.min(SUMMARY_LIMIT, data.size()))) {
            Map<String, String> item = new LinkedHashMap<>();
            item.put("title", hit.getTitle());
            item.put("snippet", hit.getSnippet());
            item.put("source", hit.getSource());
            items.add(item);
        }
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(items);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize market data summary: {}", e.getOriginalMessage());
            return "Limited market data available";
        }
    }

    MarketIntelligence toIntelligence(ObjectNode payload, String product, Timeframe timeframe, String region) {
        JsonNode price = payload.path("price_insights");
        JsonNode range = price.path("price_range");
        PriceInsight priceInsight = PriceInsight.builder()
                .minPrice(range.path("min").asDouble(0))
                .maxPrice(range.path("max").asDouble(0))
                .avgPrice(range.path("avg").asDouble(0))
                .currency(text(price, "currency", "USD"))
                .unit(text(price, "unit", null))
                .trend(text(price, "trend", "stable"))
                .factors(strings(price.path("factors")))
                .build();

        List<MarketTrend> trends = new ArrayList<>();
        for (JsonNode trend : payload.path("market_trends")) {
            trends.add(MarketTrend.builder()
                    .trendType(text(trend, "trend_type", "general"))
                    .description(text(trend, "description", ""))
                    .impact(text(trend, "impact", "medium"))
                    .confidence(Math.max(0.0, Math.min(1.0, trend.path("confidence").asDouble(0.5))))
                    .build());
        }

        return MarketIntelligence.builder()
                .productCategory(product)
                .timeframe(timeframe)
                .region(region)
                .priceInsights(priceInsight)
                .marketTrends(trends)
                .marketSize(text(payload, "market_size", null))
                .growthRate(text(payload, "growth_rate", null))
                .keyPlayers(strings(payload.path("key_players")))
                .opportunities(strings(payload.path("opportunities")))
                .risks(strings(payload.path("risks")))
                .recommendations(strings(payload.path("recommendations")))
                .build();
    }

    static MarketIntelligence fallback(String product, Timeframe timeframe, String region, List<String> sources) {
        return MarketIntelligence.builder()
                .productCategory(product)
                .timeframe(timeframe)
                .region(region)
                .priceInsights(PriceInsight.builder().build())
                .marketSize(MarketIntelligence.DATA_UNAVAILABLE)
                .growthRate(MarketIntelligence.DATA_UNAVAILABLE)
                .recommendations(new ArrayList<>(List.of("Unable to generate recommendations due to limited data")))
                .dataSources(new ArrayList<>(sources))
                .generatedBy("fallback")
                .fallback(true)
                .build();
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.path(field);
        return value.isValueNode() && !value.isNull() && !value.asText().isBlank() ? value.asText() : fallback;
    }

    private static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            if (element.isValueNode() && !element.asText().isBlank()) {
                values.add(element.asText());
            }
        }
        return values;
    }
}
