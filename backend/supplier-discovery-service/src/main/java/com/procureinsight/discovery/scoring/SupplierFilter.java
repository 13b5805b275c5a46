package com.procureinsight.discovery.scoring;

import com.procureinsight.discovery.enrichment.VerifiedSupplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Drops suppliers that do not satisfy the request criteria. Runs before scoring.
 */
@Component
@Slf4j
public class SupplierFilter {

    static final double REQUIREMENT_COVERAGE = 0.5;

    public List<VerifiedSupplier> apply(List<VerifiedSupplier> suppliers, DiscoveryCriteria criteria) {
        List<VerifiedSupplier> accepted = suppliers.stream()
                .filter(supplier -> accepts(supplier, criteria))
                .toList();
        if (accepted.size() < suppliers.size()) {
            log.info("Filtered out {} of {} suppliers", suppliers.size() - accepted.size(), suppliers.size());
        }
        return accepted;
    }

    public boolean accepts(VerifiedSupplier supplier, DiscoveryCriteria criteria) {
        return matchesLocation(supplier, criteria)
                && meetsRating(supplier, criteria)
                && holdsCertifications(supplier, criteria.certifications())
                && meetsRequirements(supplier, criteria.requirements());
    }

    boolean matchesLocation(VerifiedSupplier supplier, DiscoveryCriteria criteria) {
        if (!criteria.hasLocation() || LocationMatcher.isUnspecified(supplier.getLocation())) {
            return true;
        }
        return LocationMatcher.matches(supplier.getLocation(), criteria.location());
    }

    boolean meetsRating(VerifiedSupplier supplier, DiscoveryCriteria criteria) {
        // unrated suppliers pass
        if (criteria.minRating() == null || supplier.getRating() == null) {
            return true;
        }
        return supplier.getRating() >= criteria.minRating();
    }

    /**
     * Every requested certification must be held. A held certification satisfies a request
     * when it contains the requested text, ignoring case.
     */
    boolean holdsCertifications(VerifiedSupplier supplier, List<String> required) {
        if (required.isEmpty()) {
            return true;
        }
        List<String> held = supplier.getCertifications().stream()
                .map(cert -> cert.toLowerCase(Locale.ROOT))
                .toList();
        for (String requested : required) {
            String wanted = requested.toLowerCase(Locale.ROOT).trim();
            if (wanted.isEmpty()) {
                continue;
            }
            if (held.stream().noneMatch(cert -> cert.contains(wanted))) {
                return false;
            }
        }
        return true;
    }

    boolean meetsRequirements(VerifiedSupplier supplier, List<String> requirements) {
        List<String> phrases = requirements.stream()
                .map(requirement -> requirement.toLowerCase(Locale.ROOT).trim())
                .filter(phrase -> !phrase.isEmpty())
                .toList();
        if (phrases.isEmpty()) {
            return true;
        }
        String searchable = String.join(" ",
                supplier.getDescription() == null ? "" : supplier.getDescription(),
                String.join(" ", supplier.getSpecialties()),
                String.join(" ", supplier.getCertifications())).toLowerCase(Locale.ROOT);
        long matched = phrases.stream().filter(searchable::contains).count();
        return matched >= phrases.size() * REQUIREMENT_COVERAGE;
    }
}
