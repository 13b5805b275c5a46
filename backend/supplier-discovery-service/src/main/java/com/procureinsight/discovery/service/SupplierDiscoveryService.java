package com.procureinsight.discovery.service;

import com.procureinsight.discovery.config.DiscoveryProperties;
import com.procureinsight.discovery.dto.SupplierDiscoveryRequest;
import com.procureinsight.discovery.dto.SupplierDiscoveryResponse;
import com.procureinsight.discovery.enrichment.EnrichmentContext;
import com.procureinsight.discovery.enrichment.SupplierEnrichmentService;
import com.procureinsight.discovery.enrichment.VerifiedSupplier;
import com.procureinsight.discovery.extraction.Candidate;
import com.procureinsight.discovery.extraction.CandidateExtractor;
import com.procureinsight.discovery.scoring.DiscoveryCriteria;
import com.procureinsight.discovery.scoring.SupplierFilter;
import com.procureinsight.discovery.scoring.SupplierScoringEngine;
import com.procureinsight.discovery.search.QueryFanOutService;
import com.procureinsight.discovery.search.SearchHit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Supplier discovery pipeline: fan-out search, candidate extraction, enrichment,
 * filtering, then ranking and truncation to the requested count.
 *
 * The whole pipeline runs under the request timeout; cancelling it cancels in-flight
 * search and provider calls. Failures degrade to an empty result instead of an error.
 */
@Service
@Slf4j
public class SupplierDiscoveryService {

    /** Hits requested per wanted supplier, to leave room for filtering */
    static final int SEARCH_OVERSAMPLING = 2;

    private final QueryFanOutService fanOutService;
    private final CandidateExtractor candidateExtractor;
    private final SupplierEnrichmentService enrichmentService;
    private final SupplierFilter supplierFilter;
    private final SupplierScoringEngine scoringEngine;
    private final Clock clock;
    private final Duration requestTimeout;

    public SupplierDiscoveryService(QueryFanOutService fanOutService,
                                    CandidateExtractor candidateExtractor,
                                    SupplierEnrichmentService enrichmentService,
                                    SupplierFilter supplierFilter,
                                    SupplierScoringEngine scoringEngine,
                                    Clock clock,
                                    DiscoveryProperties properties) {
        this.fanOutService = fanOutService;
        this.candidateExtractor = candidateExtractor;
        this.enrichmentService = enrichmentService;
        this.supplierFilter = supplierFilter;
        this.scoringEngine = scoringEngine;
        this.clock = clock;
        this.requestTimeout = properties.getRequestTimeout();
    }

    public Mono<SupplierDiscoveryResponse> discover(SupplierDiscoveryRequest request) {
        DiscoveryCriteria criteria = toCriteria(request);
        return Mono.defer(() -> {
            Instant started = clock.instant();
            log.info("Starting supplier discovery for: {}", criteria.product());

            return fanOutService.searchSuppliers(criteria.product(), criteria.location(),
                            criteria.maxResults() * SEARCH_OVERSAMPLING)
                    .flatMap(hits -> {
                        if (hits.isEmpty()) {
                            log.warn("No search results found for: {}", criteria.product());
                            return Mono.just(response(criteria, List.of(), hits, started));
                        }
                        List<Candidate> candidates = candidateExtractor.extractAll(hits, criteria.location());
                        EnrichmentContext context = new EnrichmentContext(criteria.product(), criteria.requirements());
                        return enrichmentService.enrich(candidates, context)
                                .map(verified -> {
                                    List<VerifiedSupplier> filtered = supplierFilter.apply(verified, criteria);
                                    List<VerifiedSupplier> ranked = scoringEngine.rank(filtered, criteria);
                                    return response(criteria, ranked, hits, started);
                                });
                    })
                    .timeout(requestTimeout)
                    .doOnNext(result -> log.info("Supplier discovery completed in {}s, found {} suppliers",
                            String.format("%.2f", result.getProcessingTime()), result.getTotalFound()))
                    .onErrorResume(e -> {
                        if (e instanceof TimeoutException) {
                            log.warn("Supplier discovery for '{}' timed out after {}", criteria.product(), requestTimeout);
                        } else {
                            log.error("Supplier discovery failed: {}", e.getMessage(), e);
                        }
                        return Mono.just(response(criteria, List.of(), List.of(), started));
                    });
        });
    }

    public List<String> suggestions(String query, int limit) {
        List<String> suggestions = fanOutService.suggestions(query);
        return suggestions.subList(0, Math.max(0, Math.min(limit, suggestions.size())));
    }

    static DiscoveryCriteria toCriteria(SupplierDiscoveryRequest request) {
        int maxResults = request.getMaxResults() == null ? 10 : request.getMaxResults();
        return new DiscoveryCriteria(
                request.getProduct().trim(),
                request.getLocation() == null || request.getLocation().isBlank() ? null : request.getLocation().trim(),
                request.getRequirements(),
                request.getCertifications(),
                request.getMinRating(),
                maxResults);
    }

    private SupplierDiscoveryResponse response(DiscoveryCriteria criteria, List<VerifiedSupplier> ranked,
                                               List<SearchHit> hits, Instant started) {
        Set<String> sources = new LinkedHashSet<>();
        for (SearchHit hit : hits) {
            if (hit.getSource() != null && !hit.getSource().isBlank()) {
                sources.add(hit.getSource());
            }
        }
        List<VerifiedSupplier> top = ranked.size() <= criteria.maxResults()
                ? ranked
                : ranked.subList(0, criteria.maxResults());
        return SupplierDiscoveryResponse.builder()
                .suppliers(new ArrayList<>(top))
                .totalFound(ranked.size())
                .searchQuery(criteria.product())
                .locationFilter(criteria.location())
                .processingTime(Duration.between(started, clock.instant()).toMillis() / 1000.0)
                .dataSources(new ArrayList<>(sources))
                .build();
    }
}
