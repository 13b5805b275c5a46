package com.procureinsight.discovery.service;

import com.procureinsight.discovery.dto.MarketIntelligenceRequest;
import com.procureinsight.discovery.dto.MarketIntelligenceResponse;
import com.procureinsight.discovery.dto.MarketTrendsResponse;
import com.procureinsight.discovery.market.MarketIntelligenceService;
import com.procureinsight.discovery.market.Timeframe;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Request-level wrapper around {@link MarketIntelligenceService}: timed full analyses and
 * the trends-only view.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketAnalysisService {

    private final MarketIntelligenceService marketIntelligenceService;
    private final Clock clock;

    public Mono<MarketIntelligenceResponse> analyze(MarketIntelligenceRequest request) {
        return Mono.defer(() -> {
            Instant started = clock.instant();
            Timeframe timeframe = request.getTimeframe() == null ? Timeframe.SIX_MONTHS : request.getTimeframe();
            log.info("Starting market analysis for: {} ({})", request.getProduct(), timeframe.getValue());
            return marketIntelligenceService.analyze(request.getProduct().trim(), timeframe, request.getRegion())
                    .map(intelligence -> MarketIntelligenceResponse.builder()
                            .marketIntelligence(intelligence)
                            .processingTime(Duration.between(started, clock.instant()).toMillis() / 1000.0)
                            .build());
        });
    }

    public Mono<MarketTrendsResponse> trends(String product, Timeframe timeframe) {
        Timeframe effective = timeframe == null ? Timeframe.SIX_MONTHS : timeframe;
        return marketIntelligenceService.analyze(product.trim(), effective, null)
                .map(intelligence -> MarketTrendsResponse.builder()
                        .product(product.trim())
                        .timeframe(effective)
                        .trends(intelligence.getMarketTrends())
                        .priceInsights(intelligence.getPriceInsights())
                        .build());
    }
}
