package com.procureinsight.discovery.dto;

import com.procureinsight.discovery.enrichment.VerifiedSupplier;
import com.procureinsight.discovery.market.MarketIntelligence;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Supplier discovery and market intelligence for one query, with a combined confidence.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcurementAnalysisResponse {

    private String searchQuery;

    @Builder.Default
    private List<VerifiedSupplier> suppliers = new ArrayList<>();

    private int totalFound;

    private MarketIntelligence marketIntelligence;

    /** Mean supplier score averaged with the fixed market confidence */
    private double confidenceScore;

    /** Seconds */
    private double processingTime;
}
