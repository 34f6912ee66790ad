package com.heystive.guard.exception;

import com.heystive.guard.domain.RateLimitDecision;

/**
 * Thrown when a client has used up its tier's request budget for the current window.
 * Carries the rejected decision so callers can surface {@code retry_after} for backoff.
 */
public class RateLimitExceededException extends HeystiveException {

    private final RateLimitDecision decision;

    public RateLimitExceededException(RateLimitDecision decision) {
        super("Rate limit exceeded: " + decision.count() + "/" + decision.limit()
                + " in " + decision.windowSeconds() + "s, retry after "
                + decision.retryAfterSeconds() + "s");
        this.decision = decision;
    }

    public RateLimitDecision getDecision() {
        return decision;
    }

    public long getRetryAfterSeconds() {
        return decision.retryAfterSeconds();
    }
}
