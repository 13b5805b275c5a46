package com.procureinsight.discovery.enrichment;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.procureinsight.discovery.extraction.Candidate;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Candidate after verification. {@code confidenceScore} is replaced by the scoring engine;
 * {@code providerConfidence} keeps what the provider reported.
 */
@Value
@Builder(toBuilder = true)
public class VerifiedSupplier {

    public static final double FALLBACK_CONFIDENCE = 0.3;
    public static final String FALLBACK_SOURCE = "fallback";

    String name;
    String location;
    String description;
    String website;
    String domain;

    double confidenceScore;

    @JsonIgnore
    double providerConfidence;

    @Builder.Default
    Set<String> certifications = Set.of();

    /** 1.0 to 5.0, or null when unknown */
    Double rating;

    VerificationStatus verificationStatus;

    @Builder.Default
    Map<String, String> contactInfo = Map.of();

    @Builder.Default
    List<String> specialties = List.of();

    String companySize;

    /**
     * Provider that produced the record, or {@value #FALLBACK_SOURCE}
     */
    String enrichedBy;

    @JsonIgnore
    int extractionOrder;

    @JsonIgnore
    double searchRelevance;

    @JsonIgnore
    public boolean isFallback() {
        return FALLBACK_SOURCE.equals(enrichedBy);
    }

    /**
     * Deterministic low-confidence record used when no provider could enrich the candidate.
     */
    public static VerifiedSupplier fallback(Candidate candidate) {
        return VerifiedSupplier.builder()
                .name(candidate.getName())
                .location(candidate.getLocation())
                .description(candidate.getDescription())
                .website(candidate.getWebsite())
                .domain(candidate.getDomain())
                .confidenceScore(FALLBACK_CONFIDENCE)
                .providerConfidence(FALLBACK_CONFIDENCE)
                .verificationStatus(VerificationStatus.UNVERIFIED)
                .enrichedBy(FALLBACK_SOURCE)
                .extractionOrder(candidate.getExtractionOrder())
                .searchRelevance(candidate.getSearchRelevance())
                .build();
    }
}
