package com.procureinsight.discovery.cache;

import com.procureinsight.discovery.config.DiscoveryProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic removal of expired cache entries.
 *
 * A failed cycle is logged and the next one still runs. After
 * {@code sweep-failure-threshold} consecutive failures the sweeper skips an exponentially
 * growing number of cycles (capped) until a sweep succeeds again.
 */
@Component
@Slf4j
public class CacheSweeper {

    static final int MAX_SKIPPED_CYCLES = 8;

    private final TtlCache<Object> cache;
    private final int failureThreshold;

    private int consecutiveFailures;
    private int cyclesToSkip;

    public CacheSweeper(TtlCache<Object> cache, DiscoveryProperties properties) {
        this.cache = cache;
        this.failureThreshold = Math.max(1, properties.getCache().getSweepFailureThreshold());
    }

    @Scheduled(fixedDelayString = "${discovery.cache.sweep-interval:PT5M}",
            initialDelayString = "${discovery.cache.sweep-interval:PT5M}")
    public void sweepExpired() {
        if (cyclesToSkip > 0) {
            cyclesToSkip--;
            log.debug("Skipping cache sweep after repeated failures ({} cycles left)", cyclesToSkip);
            return;
        }
        try {
            int removed = cache.sweep();
            if (consecutiveFailures > 0) {
                log.info("Cache sweep recovered after {} failed cycles", consecutiveFailures);
            }
            consecutiveFailures = 0;
            if (removed > 0) {
                log.info("Cleaned up {} expired cache entries", removed);
            }
        } catch (RuntimeException e) {
            consecutiveFailures++;
            cache.recordError();
            log.error("Cache sweep failed ({} consecutive): {}", consecutiveFailures, e.getMessage(), e);
            if (consecutiveFailures >= failureThreshold) {
                int exponent = Math.min(consecutiveFailures - failureThreshold, 3);
                cyclesToSkip = Math.min(1 << exponent, MAX_SKIPPED_CYCLES);
            }
        }
    }

    int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    int getCyclesToSkip() {
        return cyclesToSkip;
    }
}
