package com.procureinsight.discovery.llm;

import reactor.core.publisher.Mono;

/**
 * A language-model completion endpoint. An error or an empty result moves the
 * {@link LlmProviderChain} to the next provider.
 */
public interface LlmProvider {

    String getName();

    boolean isEnabled();

    Mono<String> complete(String prompt);
}
