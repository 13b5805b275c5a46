package com.procureinsight.discovery.market;

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
public class PriceInsight {

    private double minPrice;
    private double maxPrice;
    private double avgPrice;

    @Builder.Default
    private String currency = "USD";

    private String unit;

    /** increasing, decreasing or stable */
    @Builder.Default
    private String trend = "stable";

    @Builder.Default
    private List<String> factors = new ArrayList<>();
}
