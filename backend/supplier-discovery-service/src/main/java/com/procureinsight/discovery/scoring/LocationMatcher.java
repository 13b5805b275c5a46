package com.procureinsight.discovery.scoring;

import com.procureinsight.discovery.extraction.Candidate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Location comparison on whole words. A US state written out on one side matches its
 * abbreviation on the other.
 */
public final class LocationMatcher {

    static final Map<String, String> STATE_ABBREVIATIONS = Map.ofEntries(
            Map.entry("alabama", "al"), Map.entry("alaska", "ak"), Map.entry("arizona", "az"),
            Map.entry("arkansas", "ar"), Map.entry("california", "ca"), Map.entry("colorado", "co"),
            Map.entry("connecticut", "ct"), Map.entry("delaware", "de"), Map.entry("florida", "fl"),
            Map.entry("georgia", "ga"), Map.entry("hawaii", "hi"), Map.entry("idaho", "id"),
            Map.entry("illinois", "il"), Map.entry("indiana", "in"), Map.entry("iowa", "ia"),
            Map.entry("kansas", "ks"), Map.entry("kentucky", "ky"), Map.entry("louisiana", "la"),
            Map.entry("maine", "me"), Map.entry("maryland", "md"), Map.entry("massachusetts", "ma"),
            Map.entry("michigan", "mi"), Map.entry("minnesota", "mn"), Map.entry("mississippi", "ms"),
            Map.entry("missouri", "mo"), Map.entry("montana", "mt"), Map.entry("nebraska", "ne"),
            Map.entry("nevada", "nv"), Map.entry("new hampshire", "nh"), Map.entry("new jersey", "nj"),
            Map.entry("new mexico", "nm"), Map.entry("new york", "ny"), Map.entry("north carolina", "nc"),
            Map.entry("north dakota", "nd"), Map.entry("ohio", "oh"), Map.entry("oklahoma", "ok"),
            Map.entry("oregon", "or"), Map.entry("pennsylvania", "pa"), Map.entry("rhode island", "ri"),
            Map.entry("south carolina", "sc"), Map.entry("south dakota", "sd"), Map.entry("tennessee", "tn"),
            Map.entry("texas", "tx"), Map.entry("utah", "ut"), Map.entry("vermont", "vt"),
            Map.entry("virginia", "va"), Map.entry("washington", "wa"), Map.entry("west virginia", "wv"),
            Map.entry("wisconsin", "wi"), Map.entry("wyoming", "wy"));

    private static final Set<String> ABBREVIATIONS = Set.copyOf(STATE_ABBREVIATIONS.values());

    private static final String STATE_PREFIX = "state:";

    private LocationMatcher() {
    }

    /**
     * True for locations that carry no information: blank, the extraction sentinel or "unknown".
     */
    public static boolean isUnspecified(String location) {
        if (location == null || location.isBlank()) {
            return true;
        }
        String normalized = location.trim().toLowerCase(Locale.ROOT);
        return normalized.equals(Candidate.LOCATION_NOT_SPECIFIED.toLowerCase(Locale.ROOT))
                || normalized.equals("unknown")
                || normalized.equals("unspecified");
    }

    /**
     * True when the requested location appears as a whole-word run inside the supplier
     * location. State names and their abbreviations compare equal, so "Houston, TX" matches
     * "Texas" while "Wichita, KS" does not match "Arkansas".
     */
    public static boolean matches(String supplierLocation, String requestedLocation) {
        if (supplierLocation == null || requestedLocation == null || requestedLocation.isBlank()) {
            return false;
        }
        List<String> requested = canonicalTokens(requestedLocation);
        if (requested.isEmpty()) {
            return false;
        }
        return Collections.indexOfSubList(canonicalTokens(supplierLocation), requested) >= 0;
    }

    /**
     * Lower-cased words with every state reference replaced by one {@code state:xx} token.
     * Two-word state names are tried before single words. A two-letter abbreviation only
     * counts when written in capitals or standing alone between commas, so "in" or "or"
     * in running text stay plain words.
     */
    static List<String> canonicalTokens(String location) {
        List<String> canonical = new ArrayList<>();
        for (String segment : location.split(",")) {
            List<String> words = Arrays.stream(segment.trim().split("[^A-Za-z]+"))
                    .filter(word -> !word.isEmpty())
                    .toList();
            boolean standsAlone = words.size() == 1;
            int i = 0;
            while (i < words.size()) {
                String word = words.get(i).toLowerCase(Locale.ROOT);
                if (i + 1 < words.size()) {
                    String pair = word + " " + words.get(i + 1).toLowerCase(Locale.ROOT);
                    if (STATE_ABBREVIATIONS.containsKey(pair)) {
                        canonical.add(STATE_PREFIX + STATE_ABBREVIATIONS.get(pair));
                        i += 2;
                        continue;
                    }
                }
                if (STATE_ABBREVIATIONS.containsKey(word)) {
                    canonical.add(STATE_PREFIX + STATE_ABBREVIATIONS.get(word));
                } else if (ABBREVIATIONS.contains(word)
                        && (standsAlone || words.get(i).equals(words.get(i).toUpperCase(Locale.ROOT)))) {
                    canonical.add(STATE_PREFIX + word);
                } else {
                    canonical.add(word);
                }
                i++;
            }
        }
        return canonical;
    }
}
