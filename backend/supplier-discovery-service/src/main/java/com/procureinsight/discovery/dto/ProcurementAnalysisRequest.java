package com.procureinsight.discovery.dto;

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
public class ProcurementAnalysisRequest {

    @NotBlank
    @Size(min = 3, max = 200)
    private String query;

    /** Used both as supplier location filter and market region */
    @Size(max = 100)
    private String location;
}
