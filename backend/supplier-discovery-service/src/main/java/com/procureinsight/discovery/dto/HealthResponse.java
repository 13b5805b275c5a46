package com.procureinsight.discovery.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponse {

    /** healthy or unhealthy */
    private String status;

    private String version;
    private LocalDateTime timestamp;

    @Builder.Default
    private Map<String, String> services = new LinkedHashMap<>();

    /** Seconds since startup */
    private double uptime;
}
