package com.procureinsight.discovery.dto;

import com.procureinsight.discovery.market.Timeframe;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketIntelligenceRequest {

    @NotBlank
    @Size(min = 3, max = 200)
    private String product;

    @Builder.Default
    private Timeframe timeframe = Timeframe.SIX_MONTHS;

    @Size(max = 100)
    private String region;
}
