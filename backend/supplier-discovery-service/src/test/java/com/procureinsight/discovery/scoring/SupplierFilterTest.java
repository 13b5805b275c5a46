package com.procureinsight.discovery.scoring;

import com.procureinsight.discovery.enrichment.VerificationStatus;
import com.procureinsight.discovery.enrichment.VerifiedSupplier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * SupplierFilter and LocationMatcher unit tests
 */
class SupplierFilterTest {

    private final SupplierFilter filter = new SupplierFilter();

    private static VerifiedSupplier.VerifiedSupplierBuilder supplier() {
        return VerifiedSupplier.builder()
                .name("Acme Steel")
                .location("Houston, TX")
                .description("structural steel fabrication")
                .providerConfidence(0.5)
                .verificationStatus(VerificationStatus.UNVERIFIED);
    }

    private static DiscoveryCriteria criteria(String location, List<String> requirements,
                                              List<String> certifications, Double minRating) {
        return new DiscoveryCriteria("steel", location, requirements, certifications, minRating, 10);
    }

    @Nested
    @DisplayName("location")
    class Location {

        @ParameterizedTest(name = "[{index}] {0} vs {1} -> {2}")
        @CsvSource(delimiter = ';', value = {
                "Houston, TX; Texas; true",
                "Dallas, Texas; TX; true",
                "Houston, Texas; houston; true",
                "Chicago, IL; California; false",
                "Portland, Oregon; Maine; false",
                "Wichita, KS; Arkansas; false",
                "Little Rock, AR; Arkansas; true",
                "Richmond, VA; West Virginia; false",
                "Charleston, WV; West Virginia; true",
                "Richmond, Virginia; VA; true",
                "Chicago, IL; CA; false",
                "San Jose, CA; ca; true",
                "Based in Ohio; Indiana; false",
                "Houston, Texas; Hous; false"
        })
        @DisplayName("matching understands state names and abbreviations")
        void matcher(String supplierLocation, String requested, boolean expected) {
            assertThat(LocationMatcher.matches(supplierLocation, requested)).isEqualTo(expected);
        }

        @Test
        @DisplayName("a supplier elsewhere is dropped")
        void mismatchDropped() {
            VerifiedSupplier chicago = supplier().location("Chicago, IL").build();

            assertThat(filter.accepts(chicago, criteria("Texas", List.of(), List.of(), null))).isFalse();
        }

        @Test
        @DisplayName("an unknown supplier location passes")
        void unspecifiedPasses() {
            VerifiedSupplier unknown = supplier().location("Location not specified").build();

            assertThat(filter.accepts(unknown, criteria("Texas", List.of(), List.of(), null))).isTrue();
        }

        @Test
        @DisplayName("without a requested location every supplier passes")
        void noLocationFilter() {
            VerifiedSupplier chicago = supplier().location("Chicago, IL").build();

            assertThat(filter.accepts(chicago, criteria(null, List.of(), List.of(), null))).isTrue();
        }
    }

    @Test
    @DisplayName("minimum rating drops low-rated suppliers but keeps unrated ones")
    void minRating() {
        DiscoveryCriteria atLeastFour = criteria(null, List.of(), List.of(), 4.0);

        assertThat(filter.accepts(supplier().rating(3.9).build(), atLeastFour)).isFalse();
        assertThat(filter.accepts(supplier().rating(4.0).build(), atLeastFour)).isTrue();
        assertThat(filter.accepts(supplier().build(), atLeastFour)).isTrue();
    }

    @Test
    @DisplayName("every requested certification must be held")
    void certificationsAreASubset() {
        DiscoveryCriteria wantsTwo = criteria(null, List.of(), List.of("ISO 9001", "AS9100"), null);

        assertThat(filter.accepts(supplier().certifications(Set.of("ISO 9001:2015", "AS9100D")).build(), wantsTwo))
                .isTrue();
        assertThat(filter.accepts(supplier().certifications(Set.of("ISO 9001")).build(), wantsTwo))
                .isFalse();
        assertThat(filter.accepts(supplier().build(), wantsTwo)).isFalse();
    }

    @Test
    @DisplayName("at least half of the requirements must be mentioned")
    void requirementCoverage() {
        VerifiedSupplier supplier = supplier().specialties(List.of("galvanizing")).build();

        assertThat(filter.accepts(supplier, criteria(null, List.of("fabrication", "galvanizing", "laser cutting"), List.of(), null)))
                .isTrue();
        assertThat(filter.accepts(supplier, criteria(null, List.of("fabrication", "anodizing", "laser cutting"), List.of(), null)))
                .isFalse();
    }

    @Test
    @DisplayName("blank requirement phrases do not count toward coverage")
    void blankRequirementsIgnored() {
        VerifiedSupplier supplier = supplier().build();

        assertThat(filter.accepts(supplier, criteria(null, List.of("fabrication", " ", "", "anodizing", "laser cutting"), List.of(), null)))
                .isFalse();
        assertThat(filter.accepts(supplier, criteria(null, List.of(" ", ""), List.of(), null)))
                .isTrue();
    }

    @Test
    @DisplayName("apply keeps the input order")
    void applyKeepsOrder() {
        List<VerifiedSupplier> kept = filter.apply(List.of(
                supplier().name("A").build(),
                supplier().name("B").location("Chicago, IL").build(),
                supplier().name("C").build()), criteria("Texas", List.of(), List.of(), null));

        assertThat(kept).extracting(VerifiedSupplier::getName).containsExactly("A", "C");
    }
}
