package com.procureinsight.discovery.market;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Synthesized market view for one product, timeframe and region.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MarketIntelligence {

    public static final String DATA_UNAVAILABLE = "Data unavailable";

    private String productCategory;
    private Timeframe timeframe;
    private String region;
    private PriceInsight priceInsights;

    @Builder.Default
    private List<MarketTrend> marketTrends = new ArrayList<>();

    private String marketSize;
    private String growthRate;

    @Builder.Default
    private List<String> keyPlayers = new ArrayList<>();

    @Builder.Default
    private List<String> opportunities = new ArrayList<>();

    @Builder.Default
    private List<String> risks = new ArrayList<>();

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    /** Search results the synthesis was based on */
    private int dataPoints;

    @Builder.Default
    private List<String> dataSources = new ArrayList<>();

    /** Provider that produced the synthesis, or {@code fallback} */
    private String generatedBy;

    private boolean fallback;
}
