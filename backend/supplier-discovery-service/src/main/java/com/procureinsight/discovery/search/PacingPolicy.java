package com.procureinsight.discovery.search;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Delay inserted between consecutive outbound calls of one series.
 */
@FunctionalInterface
public interface PacingPolicy {

    Mono<Void> pause();

    static PacingPolicy fixed(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return none();
        }
        return () -> Mono.delay(delay).then();
    }

    static PacingPolicy none() {
        return Mono::empty;
    }
}
