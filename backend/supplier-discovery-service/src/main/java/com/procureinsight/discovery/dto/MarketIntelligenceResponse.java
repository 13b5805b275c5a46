package com.procureinsight.discovery.dto;

import com.procureinsight.discovery.market.MarketIntelligence;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketIntelligenceResponse {

    private MarketIntelligence marketIntelligence;

    /** Seconds */
    private double processingTime;
}
