package com.procureinsight.discovery.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
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
public class SupplierDiscoveryRequest {

    @NotBlank
    @Size(min = 3, max = 200)
    private String product;

    @Size(max = 100)
    private String location;

    @Builder.Default
    private List<String> requirements = new ArrayList<>();

    @Builder.Default
    private List<String> certifications = new ArrayList<>();

    @DecimalMin("1.0")
    @DecimalMax("5.0")
    private Double minRating;

    @Min(1)
    @Max(50)
    @Builder.Default
    private Integer maxResults = 10;
}
