package com.procureinsight.discovery.enrichment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.procureinsight.discovery.cache.CacheKeys;
import com.procureinsight.discovery.cache.TtlCache;
import com.procureinsight.discovery.config.DiscoveryProperties;
import com.procureinsight.discovery.extraction.Candidate;
import com.procureinsight.discovery.llm.JsonPayloadExtractor;
import com.procureinsight.discovery.llm.LlmProviderChain;
import com.procureinsight.discovery.llm.ProviderResponse;
import com.procureinsight.discovery.search.PacingPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Verifies and enriches candidates through the language-model provider chain.
 *
 * Candidates are processed in fixed-size batches. Calls inside a batch run concurrently and
 * the batch completes only once every call has resolved; the pacing policy runs between
 * batches. A candidate whose providers all fail gets {@link VerifiedSupplier#fallback}, so
 * one failure never affects the rest of the batch. Provider results are cached, fallbacks
 * are not.
 */
@Service
@Slf4j
public class SupplierEnrichmentService {

    static final double DEFAULT_CONFIDENCE = 0.5;

    private final LlmProviderChain providerChain;
    private final EnrichmentPromptBuilder promptBuilder;
    private final JsonPayloadExtractor payloadExtractor;
    private final TtlCache<Object> cache;
    private final PacingPolicy pacing;
    private final int batchSize;
    private final Duration supplierTtl;

    public SupplierEnrichmentService(LlmProviderChain providerChain,
                                     EnrichmentPromptBuilder promptBuilder,
                                     JsonPayloadExtractor payloadExtractor,
                                     TtlCache<Object> cache,
                                     @Qualifier("batchPacing") PacingPolicy pacing,
                                     DiscoveryProperties properties) {
        this.providerChain = providerChain;
        this.promptBuilder = promptBuilder;
        this.payloadExtractor = payloadExtractor;
        this.cache = cache;
        this.pacing = pacing;
        this.batchSize = Math.max(1, properties.getEnrichment().getBatchSize());
        this.supplierTtl = properties.getCache().getSupplierTtl();
    }

    public Mono<List<VerifiedSupplier>> enrich(List<Candidate> candidates, EnrichmentContext context) {
        List<List<Candidate>> batches = partition(candidates);
        return Flux.range(0, batches.size())
                .concatMap(i -> (i == 0 ? Mono.<Void>empty() : pacing.pause())
                        .then(enrichBatch(batches.get(i), context)))
                .concatMapIterable(batch -> batch)
                .collectList()
                .doOnNext(verified -> log.info("Enriched {} of {} candidates ({} fallbacks)",
                        verified.size(), candidates.size(),
                        verified.stream().filter(VerifiedSupplier::isFallback).count()));
    }

    /**
     * Enriches one batch. Completes after every member has resolved, in input order.
     */
    Mono<List<VerifiedSupplier>> enrichBatch(List<Candidate> batch, EnrichmentContext context) {
        return Flux.fromIterable(batch)
                .flatMapSequential(candidate -> enrichOne(candidate, context))
                .collectList();
    }

    Mono<VerifiedSupplier> enrichOne(Candidate candidate, EnrichmentContext context) {
        if (candidate.getName() == null || candidate.getName().isBlank()) {
            log.warn("Dropping candidate without a name from {}", candidate.getWebsite());
            return Mono.empty();
        }
        String key = CacheKeys.supplierKey(candidate.getName(), candidate.getDescription());
        return cache.getOrCompute(key, VerifiedSupplier.class, supplierTtl, () -> verify(candidate, context))
                .map(verified -> verified.toBuilder()
                        .website(candidate.getWebsite())
                        .domain(candidate.getDomain())
                        .extractionOrder(candidate.getExtractionOrder())
                        .searchRelevance(candidate.getSearchRelevance())
                        .build())
                .onErrorResume(e -> {
                    log.warn("Supplier verification failed for '{}': {}", candidate.getName(), e.getMessage());
                    return Mono.just(VerifiedSupplier.fallback(candidate));
                });
    }

    private Mono<VerifiedSupplier> verify(Candidate candidate, EnrichmentContext context) {
        String prompt = promptBuilder.build(candidate, context);
        return providerChain.complete(prompt)
                .map(response -> toVerifiedSupplier(candidate, response));
    }

    VerifiedSupplier toVerifiedSupplier(Candidate candidate, ProviderResponse response) {
        ObjectNode payload = payloadExtractor.extract(response.text());
        double confidence = clamp(number(payload, "confidence_score", DEFAULT_CONFIDENCE));
        return VerifiedSupplier.builder()
                .name(textOr(payload, "name", candidate.getName()))
                .location(textOr(payload, "location", candidate.getLocation()))
                .description(textOr(payload, "description", candidate.getDescription()))
                .website(candidate.getWebsite())
                .domain(candidate.getDomain())
                .confidenceScore(confidence)
                .providerConfidence(confidence)
                .certifications(Collections.unmodifiableSet(new LinkedHashSet<>(strings(payload.get("certifications")))))
                .specialties(List.copyOf(strings(payload.get("specialties"))))
                .rating(rating(payload.get("rating")))
                .verificationStatus(VerificationStatus.fromValue(
                        textOr(payload, "verification_status", null), VerificationStatus.UNVERIFIED))
                .contactInfo(contactInfo(payload.get("contact_info")))
                .companySize(textOr(payload, "company_size", null))
                .enrichedBy(response.provider())
                .extractionOrder(candidate.getExtractionOrder())
                .searchRelevance(candidate.getSearchRelevance())
                .build();
    }

    private List<List<Candidate>> partition(List<Candidate> candidates) {
        List<List<Candidate>> batches = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i += batchSize) {
            batches.add(candidates.subList(i, Math.min(i + batchSize, candidates.size())));
        }
        return batches;
    }

    private static String textOr(JsonNode payload, String field, String fallback) {
        JsonNode node = payload.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            return fallback;
        }
        return node.asText().trim();
    }

    private static double number(JsonNode payload, String field, double fallback) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    private static Double rating(JsonNode node) {
        if (node == null || !(node.isNumber() || node.isTextual())) {
            return null;
        }
        double value = node.isNumber() ? node.asDouble() : node.asDouble(Double.NaN);
        if (Double.isNaN(value) || value < 1.0 || value > 5.0) {
            return null;
        }
        return value;
    }

    private static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return values;
        }
        for (JsonNode element : node) {
            if (element.isTextual() && !element.asText().isBlank()) {
                values.add(element.asText().trim());
            }
        }
        return values;
    }

    private static Map<String, String> contactInfo(JsonNode node) {
        Map<String, String> contact = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return contact;
        }
        node.fields().forEachRemaining(entry -> {
            JsonNode value = entry.getValue();
            if (value.isValueNode() && !value.isNull() && !value.asText().isBlank()) {
                contact.put(entry.getKey(), value.asText().trim());
            }
        });
        return Collections.unmodifiableMap(contact);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
