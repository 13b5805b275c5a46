package com.procureinsight.discovery.enrichment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.procureinsight.discovery.cache.TtlCache;
import com.procureinsight.discovery.config.DiscoveryProperties;
import com.procureinsight.discovery.exception.EnrichmentFailureException;
import com.procureinsight.discovery.extraction.Candidate;
import com.procureinsight.discovery.llm.JsonPayloadExtractor;
import com.procureinsight.discovery.llm.LlmProviderChain;
import com.procureinsight.discovery.llm.ProviderResponse;
import com.procureinsight.discovery.search.PacingPolicy;
import com.procureinsight.discovery.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * SupplierEnrichmentService unit tests
 */
@ExtendWith(MockitoExtension.class)
class SupplierEnrichmentServiceTest {

    private static final String[] NAMES = {"Candidate One", "Candidate Two", "Candidate Three",
            "Candidate Four", "Candidate Five"};

    private static final String GOOD_PAYLOAD = """
            Sure! {"name": "%s", "location": "Houston, TX", "confidence_score": 0.9,
            "certifications": ["ISO 9001", "AS9100"], "specialties": ["steel"],
            "verification_status": "verified", "rating": 4.5,
            "contact_info": {"email": "sales@example.com", "phone": ""}}""";

    private static final EnrichmentContext CONTEXT = new EnrichmentContext("industrial steel", List.of());

    @Mock
    private LlmProviderChain providerChain;

    private final AtomicInteger batchPauses = new AtomicInteger();
    private DiscoveryProperties properties;
    private SupplierEnrichmentService service;

    @BeforeEach
    void setUp() {
        properties = new DiscoveryProperties();
        ObjectMapper mapper = new ObjectMapper();
        PacingPolicy countingPacing = () -> Mono.fromRunnable(batchPauses::incrementAndGet);
        service = new SupplierEnrichmentService(providerChain, new EnrichmentPromptBuilder(mapper),
                new JsonPayloadExtractor(mapper), new TtlCache<>(Clock.systemUTC()), countingPacing, properties);
    }

    private static Candidate candidate(String name, int order) {
        return Candidate.builder()
                .name(name)
                .location("Texas")
                .description(name + " makes steel")
                .website("https://" + name.toLowerCase().replace(' ', '-') + ".com")
                .domain(name.toLowerCase().replace(' ', '-') + ".com")
                .extractionOrder(order)
                .searchRelevance(0.7)
                .build();
    }

    private static List<Candidate> candidates(int count) {
        List<Candidate> candidates = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            candidates.add(candidate(i < NAMES.length ? NAMES[i] : "Candidate " + (i + 1), i));
        }
        return candidates;
    }

    private static String nameIn(String prompt) {
        for (String name : NAMES) {
            if (prompt.contains("\"" + name + "\"")) {
                return name;
            }
        }
        return "Unknown";
    }

    @Test
    @DisplayName("one failing candidate falls back without affecting the rest of its batch")
    void failureIsIsolated() {
        // given
        when(providerChain.complete(anyString())).thenAnswer(invocation -> {
            String prompt = invocation.getArgument(0);
            if (prompt.contains("\"Candidate Three\"")) {
                return Mono.error(new EnrichmentFailureException("All language-model providers failed"));
            }
            return Mono.just(new ProviderResponse("groq", GOOD_PAYLOAD.formatted(nameIn(prompt))));
        });

        // when
        StepVerifier.create(service.enrich(candidates(5), CONTEXT))
                // then
                .assertNext(verified -> {
                    assertThat(verified).hasSize(5);
                    assertThat(verified).extracting(VerifiedSupplier::getName).containsExactly(NAMES);
                    assertThat(verified).filteredOn(VerifiedSupplier::isFallback).hasSize(1);

                    VerifiedSupplier fallback = verified.get(2);
                    assertThat(fallback.getConfidenceScore()).isEqualTo(VerifiedSupplier.FALLBACK_CONFIDENCE);
                    assertThat(fallback.getVerificationStatus()).isEqualTo(VerificationStatus.UNVERIFIED);
                    assertThat(fallback.getCertifications()).isEmpty();
                    assertThat(fallback.getRating()).isNull();

                    assertThat(verified.get(0).getEnrichedBy()).isEqualTo("groq");
                    assertThat(verified.get(0).getVerificationStatus()).isEqualTo(VerificationStatus.VERIFIED);
                })
                .verifyComplete();
    }

    @Nested
    @DisplayName("payload mapping")
    class PayloadMapping {

        private final Candidate acme = candidate("Candidate One", 0);

        @Test
        @DisplayName("provider fields are mapped and blank contact fields dropped")
        void mapsFields() {
            VerifiedSupplier supplier = service.toVerifiedSupplier(acme,
                    new ProviderResponse("groq", GOOD_PAYLOAD.formatted("Candidate One Inc")));

            assertThat(supplier.getName()).isEqualTo("Candidate One Inc");
            assertThat(supplier.getLocation()).isEqualTo("Houston, TX");
            assertThat(supplier.getProviderConfidence()).isEqualTo(0.9);
            assertThat(supplier.getCertifications()).containsExactly("ISO 9001", "AS9100");
            assertThat(supplier.getRating()).isEqualTo(4.5);
            assertThat(supplier.getContactInfo()).containsOnlyKeys("email");
            assertThat(supplier.getWebsite()).isEqualTo(acme.getWebsite());
        }

        @Test
        @DisplayName("text without JSON falls back to candidate data and neutral defaults")
        void defaultsWithoutJson() {
            VerifiedSupplier supplier = service.toVerifiedSupplier(acme,
                    new ProviderResponse("gemini", "I cannot verify this company."));

            assertThat(supplier.getName()).isEqualTo("Candidate One");
            assertThat(supplier.getProviderConfidence()).isEqualTo(0.5);
            assertThat(supplier.getVerificationStatus()).isEqualTo(VerificationStatus.UNVERIFIED);
            assertThat(supplier.getCertifications()).isEmpty();
            assertThat(supplier.getRating()).isNull();
            assertThat(supplier.isFallback()).isFalse();
        }

        @Test
        @DisplayName("out-of-range confidence is clamped and out-of-range rating dropped")
        void clampsValues() {
            VerifiedSupplier supplier = service.toVerifiedSupplier(acme, new ProviderResponse("groq",
                    "{\"confidence_score\": 1.7, \"rating\": 0.0, \"verification_status\": \"bogus\"}"));

            assertThat(supplier.getProviderConfidence()).isEqualTo(1.0);
            assertThat(supplier.getRating()).isNull();
            assertThat(supplier.getVerificationStatus()).isEqualTo(VerificationStatus.UNVERIFIED);
        }

        @Test
        @DisplayName("numeric fields sent as strings are accepted")
        void lenientNumbers() {
            VerifiedSupplier supplier = service.toVerifiedSupplier(acme, new ProviderResponse("groq",
                    "{\"confidence_score\": \"0.65\", \"rating\": \"3.5\"}"));

            assertThat(supplier.getProviderConfidence()).isCloseTo(0.65, within(1e-9));
            assertThat(supplier.getRating()).isEqualTo(3.5);
        }
    }

    @Test
    @DisplayName("an enriched candidate is served from the cache the second time")
    void cachesEnrichment() {
        when(providerChain.complete(anyString()))
                .thenReturn(Mono.just(new ProviderResponse("groq", GOOD_PAYLOAD.formatted("Candidate One"))));
        List<Candidate> one = List.of(candidate("Candidate One", 0));

        StepVerifier.create(service.enrich(one, CONTEXT)).expectNextCount(1).verifyComplete();
        StepVerifier.create(service.enrich(one, CONTEXT)).expectNextCount(1).verifyComplete();

        verify(providerChain, times(1)).complete(anyString());
    }

    @Test
    @DisplayName("enriched records stay cached for several hours by default")
    void enrichmentCachedForHours() {
        // given
        MutableClock clock = new MutableClock(Instant.parse("2026-01-05T08:00:00Z"));
        SupplierEnrichmentService hourly = new SupplierEnrichmentService(providerChain,
                new EnrichmentPromptBuilder(new ObjectMapper()), new JsonPayloadExtractor(new ObjectMapper()),
                new TtlCache<>(clock), PacingPolicy.none(), properties);
        when(providerChain.complete(anyString()))
                .thenReturn(Mono.just(new ProviderResponse("groq", GOOD_PAYLOAD.formatted("Candidate One"))));
        List<Candidate> one = List.of(candidate("Candidate One", 0));

        // when
        StepVerifier.create(hourly.enrich(one, CONTEXT)).expectNextCount(1).verifyComplete();
        clock.advance(Duration.ofHours(5));
        StepVerifier.create(hourly.enrich(one, CONTEXT)).expectNextCount(1).verifyComplete();

        // then
        verify(providerChain, times(1)).complete(anyString());
        assertThat(properties.getCache().getSupplierTtl()).isGreaterThanOrEqualTo(Duration.ofHours(2));

        clock.advance(Duration.ofHours(2));
        StepVerifier.create(hourly.enrich(one, CONTEXT)).expectNextCount(1).verifyComplete();
        verify(providerChain, times(2)).complete(anyString());
    }

    @Test
    @DisplayName("fallback records are not cached")
    void fallbackNotCached() {
        when(providerChain.complete(anyString()))
                .thenReturn(Mono.error(new EnrichmentFailureException("down")));
        List<Candidate> one = List.of(candidate("Candidate One", 0));

        StepVerifier.create(service.enrich(one, CONTEXT)).expectNextCount(1).verifyComplete();
        StepVerifier.create(service.enrich(one, CONTEXT)).expectNextCount(1).verifyComplete();

        verify(providerChain, times(2)).complete(anyString());
    }

    @Test
    @DisplayName("candidates are processed in batches with a pause between batches")
    void batchesArePaced() {
        when(providerChain.complete(anyString())).thenReturn(Mono.error(new EnrichmentFailureException("down")));

        StepVerifier.create(service.enrich(candidates(12), CONTEXT))
                .assertNext(verified -> assertThat(verified).hasSize(12)
                        .extracting(VerifiedSupplier::getExtractionOrder)
                        .containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11))
                .verifyComplete();

        assertThat(batchPauses).hasValue(2);
    }

    @Test
    @DisplayName("a candidate without a name is dropped before any provider call")
    void blankNameDropped() {
        Candidate nameless = candidate("Candidate One", 0).toBuilder().name(" ").build();

        StepVerifier.create(service.enrich(List.of(nameless), CONTEXT))
                .assertNext(verified -> assertThat(verified).isEmpty())
                .verifyComplete();

        verify(providerChain, never()).complete(anyString());
    }

    @Test
    @DisplayName("cancelling the caller cancels in-flight provider calls")
    void cancellationPropagates() {
        AtomicBoolean cancelled = new AtomicBoolean();
        when(providerChain.complete(anyString()))
                .thenReturn(Mono.<ProviderResponse>never().doOnCancel(() -> cancelled.set(true)));

        StepVerifier.create(service.enrich(candidates(1), CONTEXT).timeout(Duration.ofMillis(100)))
                .expectError(TimeoutException.class)
                .verify();

        assertThat(cancelled).isTrue();
    }
}
