package com.procureinsight.discovery.search;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic query variants derived from one user query.
 */
@Component
public class QueryVariantBuilder {

    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s-]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Clock clock;

    public QueryVariantBuilder(Clock clock) {
        this.clock = clock;
    }

    /**
     * Strips punctuation, collapses whitespace and lower-cases.
     */
    public static String cleanQuery(String query) {
        if (query == null) {
            return "";
        }
        String cleaned = NON_WORD.matcher(query.trim()).replaceAll("");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ");
        return cleaned.trim().toLowerCase(Locale.ROOT);
    }

    public List<String> supplierVariants(String query, String location) {
        String base = cleanQuery(query);
        String loc = location == null || location.isBlank() ? "" : " " + location.trim();
        return List.of(
                base + " suppliers manufacturers" + loc,
                base + " vendors distributors" + loc,
                "certified " + base + " companies" + loc,
                base + " industry directory" + loc,
                "wholesale " + base + " suppliers" + loc
        );
    }

    public List<String> marketVariants(String product, String timeframe) {
        String base = cleanQuery(product);
        int year = LocalDate.now(clock).getYear();
        return List.of(
                base + " market price " + year,
                base + " pricing trends analysis " + timeframe,
                base + " industry report market size",
                base + " cost analysis " + year,
                base + " market forecast pricing",
                base + " supply chain costs"
        );
    }

    /**
     * Auto-complete suggestions for the suppliers search box.
     */
    public List<String> suggestions(String query) {
        String base = cleanQuery(query);
        if (base.isEmpty()) {
            return List.of();
        }
        return List.of(
                base + " suppliers",
                base + " manufacturers",
                base + " vendors",
                base + " distributors",
                base + " companies"
        );
    }
}
