package com.procureinsight.discovery.search;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One raw search result. {@code relevanceScore} is adjusted by the aggregator and frozen once
 * the hit is handed to extraction.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SearchHit {

    public static final double DEFAULT_RELEVANCE = 0.5;

    private String title;
    private String url;
    private String snippet;

    /**
     * Origin domain
     */
    private String source;

    @Builder.Default
    private double relevanceScore = DEFAULT_RELEVANCE;

    /**
     * Position in the raw fan-out sequence, used as the ranking tie-breaker
     */
    private int discoveryOrder;
}
