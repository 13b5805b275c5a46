package com.procureinsight.discovery.exception;

/**
 * Search provider transport, timeout or quota failure for one query.
 * Absorbed by the fan-out, never surfaced to callers.
 */
public class SearchFailureException extends DiscoveryException {

    private final String query;

    public SearchFailureException(String query, String message, Throwable cause) {
        super("SEARCH_FAILURE", message, cause);
        this.query = query;
    }

    public String getQuery() {
        return query;
    }
}
