package com.procureinsight.discovery.config;

import com.procureinsight.discovery.search.PacingPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Pacing between outbound calls of a single series (search variants, enrichment batches).
 */
@Configuration
public class PacingConfig {

    @Bean(name = "searchPacing")
    public PacingPolicy searchPacing(DiscoveryProperties properties) {
        return PacingPolicy.fixed(properties.getSearch().getPaceDelay());
    }

    @Bean(name = "batchPacing")
    public PacingPolicy batchPacing(DiscoveryProperties properties) {
        return PacingPolicy.fixed(properties.getEnrichment().getBatchDelay());
    }
}
