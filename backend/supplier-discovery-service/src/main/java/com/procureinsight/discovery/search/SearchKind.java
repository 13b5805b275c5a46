package com.procureinsight.discovery.search;

import java.util.List;

/**
 * Vocabulary used to boost results of one search flavor.
 */
public enum SearchKind {

    SUPPLIER(0.2, List.of(
            "supplier", "manufacturer", "vendor", "distributor", "company",
            "corporation", "inc", "llc", "ltd", "wholesale", "industrial",
            "factory", "producer", "exporter", "importer")),

    MARKET(0.3, List.of(
            "market", "price", "pricing", "cost", "analysis", "report",
            "trend", "forecast", "industry", "research", "data",
            "statistics", "survey", "outlook", "intelligence")),

    /** Single-query search: dedup and ranking only */
    GENERAL(0.0, List.of());

    private final double boost;
    private final List<String> keywords;

    SearchKind(double boost, List<String> keywords) {
        this.boost = boost;
        this.keywords = keywords;
    }

    public double getBoost() {
        return boost;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public String cacheSegment() {
        return name().toLowerCase();
    }
}
