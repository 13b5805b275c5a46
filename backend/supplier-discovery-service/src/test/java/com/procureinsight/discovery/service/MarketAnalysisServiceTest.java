package com.procureinsight.discovery.service;

import com.procureinsight.discovery.dto.MarketIntelligenceRequest;
import com.procureinsight.discovery.market.MarketIntelligence;
import com.procureinsight.discovery.market.MarketIntelligenceService;
import com.procureinsight.discovery.market.MarketTrend;
import com.procureinsight.discovery.market.PriceInsight;
import com.procureinsight.discovery.market.Timeframe;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MarketAnalysisServiceTest {

    @Mock
    private MarketIntelligenceService marketIntelligenceService;

    private MarketAnalysisService service;

    @BeforeEach
    void setUp() {
        service = new MarketAnalysisService(marketIntelligenceService,
                Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC));
    }

    private static MarketIntelligence intelligence(Timeframe timeframe) {
        return MarketIntelligence.builder()
                .productCategory("copper wire")
                .timeframe(timeframe)
                .marketTrends(List.of(MarketTrend.builder()
                        .trendType("demand")
                        .description("Grid buildout lifts demand")
                        .impact("high")
                        .confidence(0.8)
                        .build()))
                .priceInsights(PriceInsight.builder().minPrice(8.0).maxPrice(10.0).avgPrice(9.0).build())
                .keyPlayers(List.of("Southwire"))
                .generatedBy("groq")
                .build();
    }

    @Test
    @DisplayName("a request without timeframe is analyzed over six months")
    void defaultTimeframe() {
        when(marketIntelligenceService.analyze("copper wire", Timeframe.SIX_MONTHS, null))
                .thenReturn(Mono.just(intelligence(Timeframe.SIX_MONTHS)));
        MarketIntelligenceRequest request = new MarketIntelligenceRequest(" copper wire ", null, null);

        StepVerifier.create(service.analyze(request))
                .assertNext(response -> {
                    assertThat(response.getMarketIntelligence().getTimeframe()).isEqualTo(Timeframe.SIX_MONTHS);
                    assertThat(response.getProcessingTime()).isZero();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("trends carry only the trend list and the price insight")
    void trendsView() {
        when(marketIntelligenceService.analyze("copper wire", Timeframe.THREE_MONTHS, null))
                .thenReturn(Mono.just(intelligence(Timeframe.THREE_MONTHS)));

        StepVerifier.create(service.trends("copper wire", Timeframe.THREE_MONTHS))
                .assertNext(response -> {
                    assertThat(response.getProduct()).isEqualTo("copper wire");
                    assertThat(response.getTimeframe()).isEqualTo(Timeframe.THREE_MONTHS);
                    assertThat(response.getTrends()).extracting(MarketTrend::getTrendType).containsExactly("demand");
                    assertThat(response.getPriceInsights().getAvgPrice()).isEqualTo(9.0);
                })
                .verifyComplete();
    }
}
