package com.procureinsight.discovery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * ProcureInsight Supplier Discovery Service
 *
 * Spring Boot WebFlux service that turns a procurement query into a ranked supplier list
 * - search fan-out against an external search provider
 * - heuristic candidate extraction from search snippets
 * - language-model enrichment with provider fallback
 * - deterministic scoring, in-memory TTL caching and rate limiting
 */
@SpringBootApplication
@EnableScheduling
public class DiscoveryApplication {

    public static void main(String[] args) {
        SpringApplication.run(DiscoveryApplication.class, args);
    }
}
