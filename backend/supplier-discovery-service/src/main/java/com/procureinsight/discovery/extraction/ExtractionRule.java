package com.procureinsight.discovery.extraction;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One extraction strategy: yields a value or nothing.
 */
@FunctionalInterface
public interface ExtractionRule {

    Optional<String> extract(String text);

    /**
     * First match of {@code pattern}, capture group 1, trimmed.
     */
    static ExtractionRule firstGroup(Pattern pattern) {
        return text -> {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return Optional.of(matcher.group(1).trim());
            }
            return Optional.empty();
        };
    }

    static ExtractionRule firstGroup(String regex) {
        return firstGroup(Pattern.compile(regex));
    }
}
