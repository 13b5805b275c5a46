package com.procureinsight.discovery.market;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketTrend {

    /** pricing, demand, supply, technology or general */
    private String trendType;
    private String description;

    /** high, medium or low */
    private String impact;
    private double confidence;
}
