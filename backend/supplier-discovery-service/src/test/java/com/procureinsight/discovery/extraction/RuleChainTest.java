package com.procureinsight.discovery.extraction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class RuleChainTest {

    @Test
    @DisplayName("the first accepted value wins, rejected values fall through")
    void firstAcceptedWins() {
        RuleChain chain = RuleChain.of(value -> value.length() > 2,
                text -> Optional.of("ab"),
                ExtractionRule.firstGroup("(\\d+)"),
                text -> Optional.of("never"));

        assertThat(chain.evaluate("order 12345")).contains("12345");
        assertThat(chain.evaluate("order 7")).contains("never");
    }

    @Test
    @DisplayName("then appends without changing the original chain")
    void thenIsNonDestructive() {
        RuleChain base = RuleChain.of(value -> true, ExtractionRule.firstGroup("(x)"));
        RuleChain extended = base.then(text -> Optional.of("fallback"));

        assertThat(base.evaluate("abc")).isEmpty();
        assertThat(extended.evaluate("abc")).contains("fallback");
        assertThat(base.size()).isEqualTo(1);
    }
}
