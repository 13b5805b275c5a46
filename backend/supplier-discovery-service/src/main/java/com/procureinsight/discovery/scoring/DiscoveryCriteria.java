package com.procureinsight.discovery.scoring;

import java.util.List;

/**
 * What the caller asked for. Drives filtering and the location and specialty score terms.
 *
 * @param location   optional free-text location, {@code null} when not requested
 * @param minRating  optional minimum rating, {@code null} when not requested
 */
public record DiscoveryCriteria(
        String product,
        String location,
        List<String> requirements,
        List<String> certifications,
        Double minRating,
        int maxResults
) {
    public DiscoveryCriteria {
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
        certifications = certifications == null ? List.of() : List.copyOf(certifications);
    }

    public boolean hasLocation() {
        return location != null && !location.isBlank();
    }
}
