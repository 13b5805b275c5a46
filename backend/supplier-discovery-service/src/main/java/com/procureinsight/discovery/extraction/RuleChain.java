package com.procureinsight.discovery.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Ordered rules evaluated until the first one yields an accepted value.
 */
public final class RuleChain {

    private final List<ExtractionRule> rules;
    private final Predicate<String> acceptance;

    private RuleChain(List<ExtractionRule> rules, Predicate<String> acceptance) {
        this.rules = List.copyOf(rules);
        this.acceptance = acceptance;
    }

    public static RuleChain of(Predicate<String> acceptance, ExtractionRule... rules) {
        return new RuleChain(List.of(rules), acceptance);
    }

    /**
     * New chain with {@code rule} evaluated after the existing ones.
     */
    public RuleChain then(ExtractionRule rule) {
        List<ExtractionRule> extended = new ArrayList<>(rules);
        extended.add(rule);
        return new RuleChain(extended, acceptance);
    }

    public Optional<String> evaluate(String text) {
        if (text == null) {
            return Optional.empty();
        }
        for (ExtractionRule rule : rules) {
            Optional<String> value = rule.extract(text).filter(acceptance);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    public int size() {
        return rules.size();
    }
}
