package com.procureinsight.discovery.service;

import com.procureinsight.discovery.dto.MarketIntelligenceRequest;
import com.procureinsight.discovery.dto.ProcurementAnalysisRequest;
import com.procureinsight.discovery.dto.ProcurementAnalysisResponse;
import com.procureinsight.discovery.dto.SupplierDiscoveryRequest;
import com.procureinsight.discovery.enrichment.VerifiedSupplier;
import com.procureinsight.discovery.market.Timeframe;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Full procurement analysis: supplier discovery and market analysis run concurrently for
 * the same query and are joined into one response.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProcurementAnalysisService {

    /** Confidence assigned to the market side of the analysis */
    static final double MARKET_CONFIDENCE = 0.8;

    static final int SUPPLIER_COUNT = 10;

    private final SupplierDiscoveryService supplierDiscoveryService;
    private final MarketAnalysisService marketAnalysisService;
    private final Clock clock;

    public Mono<ProcurementAnalysisResponse> analyze(ProcurementAnalysisRequest request) {
        return Mono.defer(() -> {
            Instant started = clock.instant();
            String query = request.getQuery().trim();
            log.info("Starting procurement analysis for: {}", query);

            SupplierDiscoveryRequest supplierRequest = SupplierDiscoveryRequest.builder()
                    .product(query)
                    .location(request.getLocation())
                    .maxResults(SUPPLIER_COUNT)
                    .build();
            MarketIntelligenceRequest marketRequest = MarketIntelligenceRequest.builder()
                    .product(query)
                    .timeframe(Timeframe.SIX_MONTHS)
                    .region(request.getLocation())
                    .build();

            return Mono.zip(supplierDiscoveryService.discover(supplierRequest),
                            marketAnalysisService.analyze(marketRequest))
                    .map(results -> {
                        List<VerifiedSupplier> suppliers = results.getT1().getSuppliers();
                        double processingTime = Duration.between(started, clock.instant()).toMillis() / 1000.0;
                        log.info("Procurement analysis completed in {}s: {} suppliers", processingTime, suppliers.size());
                        return ProcurementAnalysisResponse.builder()
                                .searchQuery(query)
                                .suppliers(suppliers)
                                .totalFound(results.getT1().getTotalFound())
                                .marketIntelligence(results.getT2().getMarketIntelligence())
                                .confidenceScore(overallConfidence(suppliers))
                                .processingTime(processingTime)
                                .build();
                    });
        });
    }

    static double overallConfidence(List<VerifiedSupplier> suppliers) {
        double supplierConfidence = suppliers.stream()
                .mapToDouble(VerifiedSupplier::getConfidenceScore)
                .average()
                .orElse(0.0);
        return (supplierConfidence + MARKET_CONFIDENCE) / 2;
    }
}
