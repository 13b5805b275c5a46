package com.procureinsight.discovery.enrichment;

import java.util.List;

/**
 * Request-level hints passed to every enrichment prompt.
 */
public record EnrichmentContext(String product, List<String> requirements) {

    public EnrichmentContext {
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
    }
}
