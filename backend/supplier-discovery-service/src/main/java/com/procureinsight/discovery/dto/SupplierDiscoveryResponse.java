package com.procureinsight.discovery.dto;

import com.procureinsight.discovery.enrichment.VerifiedSupplier;
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
public class SupplierDiscoveryResponse {

    @Builder.Default
    private List<VerifiedSupplier> suppliers = new ArrayList<>();

    /** Suppliers that survived filtering, before truncation to the requested count */
    private int totalFound;

    private String searchQuery;
    private String locationFilter;

    /** Seconds */
    private double processingTime;

    @Builder.Default
    private List<String> dataSources = new ArrayList<>();
}
