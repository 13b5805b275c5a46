package com.procureinsight.discovery.extraction;

import com.procureinsight.discovery.search.SearchHit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Heuristic mapping from a search hit to a {@link Candidate}.
 *
 * Company names come from the title, locations from the snippet. Each is an ordered
 * {@link RuleChain}; a candidate whose name is shorter than three characters is rejected.
 */
@Component
@Slf4j
public class CandidateExtractor {

    static final int MIN_NAME_LENGTH = 3;

    private static final Pattern LIST_NUMBERING = Pattern.compile("^\\d+\\.\\s*");
    private static final Pattern DASH_SUFFIX = Pattern.compile("\\s+-\\s+.*$");
    private static final Pattern PIPE_SUFFIX = Pattern.compile("\\s*\\|.*$");

    private static final RuleChain NAME_RULES = RuleChain.of(
            name -> name.length() >= MIN_NAME_LENGTH,
            // legal suffix
            ExtractionRule.firstGroup("([A-Z][a-zA-Z0-9\\s&.,]+?(?:Inc\\.?|LLC|Ltd\\.?|Corp\\.?|Corporation|Company|Co\\.))(?![a-zA-Z])"),
            // capitalized phrase of bounded length
            ExtractionRule.firstGroup("([A-Z][a-zA-Z0-9\\s&.,]{2,30})"),
            // head before the first separator
            ExtractionRule.firstGroup("^([^-|]+)")
    );

    private static final RuleChain LOCATION_RULES = RuleChain.of(
            location -> location.length() >= MIN_NAME_LENGTH,
            ExtractionRule.firstGroup(
                    "(?:located|based|headquartered|headquarters|office)\\s+(?:in|at)\\s+([A-Z][a-zA-Z]+(?:(?:\\s|,\\s*)[A-Z][a-zA-Z]+)*)"),
            // City, ST
            ExtractionRule.firstGroup("\\b([A-Z][a-zA-Z]+(?:\\s[A-Z][a-zA-Z]+)*,\\s*[A-Z]{2})\\b"),
            // City, Country
            ExtractionRule.firstGroup("\\b([A-Z][a-zA-Z]+(?:\\s[A-Z][a-zA-Z]+)*,\\s*[A-Z][a-zA-Z]+(?:\\s[A-Z][a-zA-Z]+)*)")
    );

    /**
     * @return the candidate, or empty when the name is too short
     */
    public Optional<Candidate> extract(SearchHit hit, String preferredLocation) {
        String name = extractCompanyName(hit.getTitle());
        if (name.length() < MIN_NAME_LENGTH) {
            log.debug("Rejected search hit with short name: '{}'", hit.getTitle());
            return Optional.empty();
        }
        return Optional.of(Candidate.builder()
                .name(name)
                .location(extractLocation(hit.getSnippet(), preferredLocation))
                .description(hit.getSnippet() == null ? "" : hit.getSnippet())
                .website(hit.getUrl())
                .domain(domainOf(hit))
                .sourceTitle(hit.getTitle())
                .searchRelevance(hit.getRelevanceScore())
                .build());
    }

    /**
     * Extracts every hit in order and numbers the accepted candidates.
     */
    public List<Candidate> extractAll(List<SearchHit> hits, String preferredLocation) {
        List<Candidate> candidates = new ArrayList<>();
        for (SearchHit hit : hits) {
            extract(hit, preferredLocation).ifPresent(candidate ->
                    candidates.add(candidate.toBuilder().extractionOrder(candidates.size()).build()));
        }
        log.info("Extracted {} candidates from {} search hits", candidates.size(), hits.size());
        return candidates;
    }

    String extractCompanyName(String title) {
        if (title == null) {
            return "";
        }
        String head = LIST_NUMBERING.matcher(title.trim()).replaceFirst("");
        head = DASH_SUFFIX.matcher(head).replaceFirst("");
        head = PIPE_SUFFIX.matcher(head).replaceFirst("");
        return NAME_RULES.evaluate(head).orElse(head.trim());
    }

    String extractLocation(String snippet, String preferredLocation) {
        if (snippet == null || snippet.isBlank()) {
            return Candidate.LOCATION_NOT_SPECIFIED;
        }
        RuleChain rules = LOCATION_RULES;
        if (preferredLocation != null && !preferredLocation.isBlank()) {
            String preferred = preferredLocation.trim();
            rules = rules.then(text -> text.toLowerCase(Locale.ROOT).contains(preferred.toLowerCase(Locale.ROOT))
                    ? Optional.of(preferred)
                    : Optional.empty());
        }
        return rules.evaluate(snippet).orElse(Candidate.LOCATION_NOT_SPECIFIED);
    }

    private static String domainOf(SearchHit hit) {
        if (hit.getSource() != null && !hit.getSource().isBlank()) {
            return hit.getSource();
        }
        if (hit.getUrl() == null) {
            return "";
        }
        try {
            String host = URI.create(hit.getUrl().trim()).getHost();
            return host == null ? "" : host;
        } catch (IllegalArgumentException e) {
            log.debug("Unparseable candidate URL {}: {}", hit.getUrl(), e.getMessage());
            return "";
        }
    }
}
