package com.procureinsight.discovery.scoring;

import com.procureinsight.discovery.enrichment.VerifiedSupplier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Weighted confidence score and final ordering.
 *
 * The score is recomputed for every supplier; the provider's own confidence is only the
 * first weighted input. Ordering is by descending score, ties in extraction order.
 */
@Component
public class SupplierScoringEngine {

    static final double CONFIDENCE_WEIGHT = 0.40;
    static final double STATUS_WEIGHT = 0.20;
    static final double RATING_WEIGHT = 0.15;
    static final double CERTIFICATION_WEIGHT = 0.10;
    static final double LOCATION_WEIGHT = 0.10;
    static final double SPECIALTY_WEIGHT = 0.05;

    static final int CERTIFICATION_CAP = 5;

    public double score(VerifiedSupplier supplier, DiscoveryCriteria criteria) {
        double score = supplier.getProviderConfidence() * CONFIDENCE_WEIGHT;

        if (supplier.getVerificationStatus() != null) {
            score += supplier.getVerificationStatus().getWeight() * STATUS_WEIGHT;
        }
        if (supplier.getRating() != null) {
            score += (supplier.getRating() / 5.0) * RATING_WEIGHT;
        }
        score += Math.min((double) supplier.getCertifications().size() / CERTIFICATION_CAP, 1.0) * CERTIFICATION_WEIGHT;

        if (criteria.hasLocation() && !LocationMatcher.isUnspecified(supplier.getLocation())
                && LocationMatcher.matches(supplier.getLocation(), criteria.location())) {
            score += LOCATION_WEIGHT;
        }
        score += specialtyRelevance(supplier.getSpecialties(), criteria.product()) * SPECIALTY_WEIGHT;

        return Math.max(0.0, Math.min(1.0, score));
    }

    /**
     * Scored copies of the suppliers, best first.
     */
    public List<VerifiedSupplier> rank(List<VerifiedSupplier> suppliers, DiscoveryCriteria criteria) {
        List<VerifiedSupplier> scored = new ArrayList<>(suppliers.size());
        for (VerifiedSupplier supplier : suppliers) {
            scored.add(supplier.toBuilder().confidenceScore(score(supplier, criteria)).build());
        }
        scored.sort(Comparator.comparingDouble(VerifiedSupplier::getConfidenceScore).reversed()
                .thenComparingInt(VerifiedSupplier::getExtractionOrder));
        return scored;
    }

    /**
     * Share of product words that appear among the specialty words.
     */
    static double specialtyRelevance(List<String> specialties, String product) {
        if (specialties.isEmpty() || product == null || product.isBlank()) {
            return 0.0;
        }
        Set<String> productWords = words(product);
        Set<String> specialtyWords = words(String.join(" ", specialties));
        long overlap = productWords.stream().filter(specialtyWords::contains).count();
        return productWords.isEmpty() ? 0.0 : (double) overlap / productWords.size();
    }

    private static Set<String> words(String text) {
        String trimmed = text.toLowerCase(Locale.ROOT).trim();
        if (trimmed.isEmpty()) {
            return Set.of();
        }
        return new HashSet<>(Arrays.asList(trimmed.split("\\s+")));
    }
}
