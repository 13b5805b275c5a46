package com.procureinsight.discovery.llm;

/**
 * Completion text and the provider that produced it.
 */
public record ProviderResponse(String provider, String text) {
}
