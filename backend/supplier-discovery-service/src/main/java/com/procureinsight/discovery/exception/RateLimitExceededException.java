package com.procureinsight.discovery.exception;

import com.procureinsight.discovery.ratelimit.RateLimitDecision;

/**
 * Admission denied by a rate limiter. Carries the decision so callers can report
 * limit, window and retry-after.
 */
public class RateLimitExceededException extends DiscoveryException {

    private final String limiterName;
    private final transient RateLimitDecision decision;

    public RateLimitExceededException(String limiterName, RateLimitDecision decision) {
        super("RATE_LIMIT_EXCEEDED", String.format("Rate limit exceeded for %s, retry after %ds",
                limiterName, decision.retryAfterSeconds()));
        this.limiterName = limiterName;
        this.decision = decision;
    }

    public String getLimiterName() {
        return limiterName;
    }

    public RateLimitDecision getDecision() {
        return decision;
    }
}
