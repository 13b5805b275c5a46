package com.procureinsight.discovery.controller;

import com.procureinsight.discovery.dto.MarketIntelligenceRequest;
import com.procureinsight.discovery.dto.MarketIntelligenceResponse;
import com.procureinsight.discovery.dto.MarketTrendsResponse;
import com.procureinsight.discovery.dto.ProcurementAnalysisRequest;
import com.procureinsight.discovery.dto.ProcurementAnalysisResponse;
import com.procureinsight.discovery.dto.SupplierDiscoveryRequest;
import com.procureinsight.discovery.dto.SupplierDiscoveryResponse;
import com.procureinsight.discovery.market.Timeframe;
import com.procureinsight.discovery.service.MarketAnalysisService;
import com.procureinsight.discovery.service.ProcurementAnalysisService;
import com.procureinsight.discovery.service.SupplierDiscoveryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Validated
@Tag(name = "Discovery", description = "Supplier discovery and market intelligence API")
@Slf4j
public class DiscoveryController {

    private final SupplierDiscoveryService supplierDiscoveryService;
    private final MarketAnalysisService marketAnalysisService;
    private final ProcurementAnalysisService procurementAnalysisService;

    @Operation(summary = "Procurement analysis",
            description = "Supplier discovery and market intelligence for one query, run concurrently.")
    @PostMapping("/procurement/analyze")
    public Mono<ResponseEntity<ProcurementAnalysisResponse>> analyzeProcurement(
            @Valid @RequestBody ProcurementAnalysisRequest request
    ) {
        log.info("Procurement analysis requested: query='{}', location='{}'", request.getQuery(), request.getLocation());
        return procurementAnalysisService.analyze(request).map(ResponseEntity::ok);
    }

    @Operation(summary = "Discover suppliers", description = "Searches, verifies and ranks suppliers for a product.")
    @PostMapping("/suppliers/discover")
    public Mono<ResponseEntity<SupplierDiscoveryResponse>> discoverSuppliers(
            @Valid @RequestBody SupplierDiscoveryRequest request
    ) {
        log.info("Supplier discovery requested: product='{}', location='{}'", request.getProduct(), request.getLocation());
        return supplierDiscoveryService.discover(request).map(ResponseEntity::ok);
    }

    @Operation(summary = "Search suggestions", description = "Auto-complete suggestions for the supplier search box.")
    @GetMapping("/suppliers/suggestions")
    public ResponseEntity<Map<String, Object>> suggestions(
            @RequestParam String query,
            @RequestParam(defaultValue = "5") int limit
    ) {
        List<String> suggestions = supplierDiscoveryService.suggestions(query, limit);
        return ResponseEntity.ok(Map.of("query", query, "suggestions", suggestions));
    }

    @Operation(summary = "Market intelligence", description = "Pricing insight, trends and risks for a product.")
    @PostMapping("/market/intelligence")
    public Mono<ResponseEntity<MarketIntelligenceResponse>> marketIntelligence(
            @Valid @RequestBody MarketIntelligenceRequest request
    ) {
        return marketAnalysisService.analyze(request).map(ResponseEntity::ok);
    }

    @Operation(summary = "Market trends", description = "Trends and price insight only, for a product and timeframe.")
    @GetMapping("/market/trends")
    public Mono<ResponseEntity<MarketTrendsResponse>> marketTrends(
            @RequestParam String product,
            @RequestParam(defaultValue = "6months") String timeframe
    ) {
        if (product.trim().length() < 2) {
            return Mono.error(new ServerWebInputException("Product name must be at least 2 characters long"));
        }
        Timeframe parsed;
        try {
            parsed = Timeframe.fromValue(timeframe);
        } catch (IllegalArgumentException e) {
            return Mono.error(new ServerWebInputException(e.getMessage()));
        }
        return marketAnalysisService.trends(product, parsed).map(ResponseEntity::ok);
    }
}
