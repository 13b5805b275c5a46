package com.procureinsight.discovery.search;

import java.util.List;

/**
 * Cached outcome of one fan-out: the full deduplicated, filtered and ranked list.
 */
public record AggregatedResults(List<SearchHit> hits) {

    public AggregatedResults {
        hits = List.copyOf(hits);
    }

    public boolean isEmpty() {
        return hits.isEmpty();
    }

    public List<SearchHit> top(int count) {
        return hits.size() <= count ? hits : hits.subList(0, count);
    }
}
