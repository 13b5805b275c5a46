package com.procureinsight.discovery.search;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * External web search. Implementations signal transport, timeout and quota problems as
 * errors; the fan-out treats every error as zero results for that query.
 */
public interface SearchProvider {

    String getName();

    boolean isAvailable();

    Mono<List<SearchHit>> search(String query, int maxResults);
}
