package com.procureinsight.discovery.enrichment;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum VerificationStatus {

    VERIFIED("verified", 1.0),
    UNVERIFIED("unverified", 0.5),
    PENDING("pending", 0.3),
    FAILED("failed", 0.0);

    private final String value;
    private final double weight;

    VerificationStatus(String value, double weight) {
        this.value = value;
        this.weight = weight;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Contribution of this status to the ranking score, before the 0.20 factor
     */
    public double getWeight() {
        return weight;
    }

    /**
     * Lenient parse of a provider-supplied status. Unknown or missing values map to {@code fallback}.
     */
    public static VerificationStatus fromValue(String raw, VerificationStatus fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (VerificationStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        return fallback;
    }
}
