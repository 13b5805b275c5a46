package com.procureinsight.discovery.extraction;

import lombok.Builder;
import lombok.Value;

/**
 * Supplier extracted from one search hit, before verification.
 */
@Value
@Builder(toBuilder = true)
public class Candidate {

    public static final String LOCATION_NOT_SPECIFIED = "Location not specified";

    String name;
    String location;

    /**
     * Source snippet
     */
    String description;

    String website;
    String domain;
    String sourceTitle;
    double searchRelevance;

    /**
     * Position among the accepted candidates of one request, the final ranking tie-breaker
     */
    int extractionOrder;
}
