package com.procureinsight.discovery.exception;

/**
 * Every language-model provider failed for one prompt.
 */
public class EnrichmentFailureException extends DiscoveryException {

    public EnrichmentFailureException(String message) {
        super("ENRICHMENT_FAILURE", message);
    }

    public EnrichmentFailureException(String message, Throwable cause) {
        super("ENRICHMENT_FAILURE", message, cause);
    }
}
