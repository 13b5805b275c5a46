package com.procureinsight.discovery.dto;

import com.procureinsight.discovery.market.MarketTrend;
import com.procureinsight.discovery.market.PriceInsight;
import com.procureinsight.discovery.market.Timeframe;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketTrendsResponse {

    private String product;
    private Timeframe timeframe;

    @Builder.Default
    private List<MarketTrend> trends = new ArrayList<>();

    private PriceInsight priceInsights;
}
