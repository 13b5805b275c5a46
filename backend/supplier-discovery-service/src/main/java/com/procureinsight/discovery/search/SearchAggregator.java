package com.procureinsight.discovery.search;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns the raw fan-out sequence into a deduplicated, filtered and ranked list.
 *
 * Steps, in order: dedup by normalized URL and title, drop spam, keyword boost for the
 * search kind, query-term overlap boost, stable sort by score. Input hits are never mutated.
 */
@Component
public class SearchAggregator {

    static final double TITLE_OVERLAP_WEIGHT = 0.3;
    static final double SNIPPET_OVERLAP_WEIGHT = 0.1;

    static final List<String> SPAM_INDICATORS = List.of(
            "download", "free", "click here", "sign up", "register now",
            "limited time", "special offer", "discount", "sale",
            "wikipedia", "amazon.com", "ebay.com", "social media");

    private static final Pattern SPAM_PATTERN = Pattern.compile(
            SPAM_INDICATORS.stream()
                    .map(Pattern::quote)
                    .collect(Collectors.joining("|", "\\b(?:", ")\\b")),
            Pattern.CASE_INSENSITIVE);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public List<SearchHit> aggregate(List<SearchHit> rawHits, String originalQuery, SearchKind kind) {
        List<SearchHit> unique = deduplicate(rawHits);
        List<SearchHit> accepted = new ArrayList<>(unique.size());
        for (SearchHit hit : unique) {
            if (isSpam(hit)) {
                continue;
            }
            accepted.add(boost(hit, kind));
        }
        return rank(accepted, originalQuery);
    }

    /**
     * Keeps the first hit for each normalized URL and each normalized title.
     */
    public List<SearchHit> deduplicate(List<SearchHit> hits) {
        Set<String> seenUrls = new HashSet<>();
        Set<String> seenTitles = new HashSet<>();
        List<SearchHit> unique = new ArrayList<>();
        for (SearchHit hit : hits) {
            String url = normalizeUrl(hit.getUrl());
            String title = normalizeTitle(hit.getTitle());
            if (seenUrls.contains(url) || seenTitles.contains(title)) {
                continue;
            }
            seenUrls.add(url);
            seenTitles.add(title);
            unique.add(hit);
        }
        return unique;
    }

    public boolean isSpam(SearchHit hit) {
        return SPAM_PATTERN.matcher(content(hit)).find();
    }

    SearchHit boost(SearchHit hit, SearchKind kind) {
        if (kind.getKeywords().isEmpty()) {
            return hit.toBuilder().build();
        }
        String content = content(hit);
        boolean matches = kind.getKeywords().stream().anyMatch(content::contains);
        double score = matches ? Math.min(hit.getRelevanceScore() + kind.getBoost(), 1.0) : hit.getRelevanceScore();
        return hit.toBuilder().relevanceScore(score).build();
    }

    /**
     * Adds the query-term overlap boost and sorts by score, ties in discovery order.
     */
    public List<SearchHit> rank(List<SearchHit> hits, String originalQuery) {
        Set<String> queryTerms = terms(originalQuery);
        List<SearchHit> ranked = new ArrayList<>(hits.size());
        for (SearchHit hit : hits) {
            double score = hit.getRelevanceScore();
            if (!queryTerms.isEmpty()) {
                Set<String> titleTerms = terms(hit.getTitle());
                Set<String> snippetTerms = terms(hit.getSnippet());
                long titleOverlap = queryTerms.stream().filter(titleTerms::contains).count();
                long snippetOverlap = queryTerms.stream().filter(snippetTerms::contains).count();
                double boost = (titleOverlap * TITLE_OVERLAP_WEIGHT + snippetOverlap * SNIPPET_OVERLAP_WEIGHT)
                        / queryTerms.size();
                score = Math.min(score + boost, 1.0);
            }
            ranked.add(hit.getRelevanceScore() == score ? hit : hit.toBuilder().relevanceScore(score).build());
        }
        ranked.sort(Comparator.comparingDouble(SearchHit::getRelevanceScore).reversed()
                .thenComparingInt(SearchHit::getDiscoveryOrder));
        return ranked;
    }

    static String normalizeUrl(String url) {
        if (url == null) {
            return "";
        }
        String normalized = url.trim().toLowerCase(Locale.ROOT);
        int start = 0;
        int end = normalized.length();
        while (start < end && normalized.charAt(start) == '/') start++;
        while (end > start && normalized.charAt(end - 1) == '/') end--;
        return normalized.substring(start, end);
    }

    static String normalizeTitle(String title) {
        if (title == null) {
            return "";
        }
        return WHITESPACE.matcher(title.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    private static Set<String> terms(String text) {
        String cleaned = QueryVariantBuilder.cleanQuery(text);
        if (cleaned.isEmpty()) {
            return Set.of();
        }
        return new HashSet<>(Arrays.asList(cleaned.split(" ")));
    }

    private static String content(SearchHit hit) {
        return (nullToEmpty(hit.getTitle()) + " " + nullToEmpty(hit.getSnippet())).toLowerCase(Locale.ROOT);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
