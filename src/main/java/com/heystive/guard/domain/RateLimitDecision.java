package com.heystive.guard.domain;

import java.time.Instant;

/**
 * Result of a sliding-window rate-limit check, surfaced to callers as response metadata.
 *
 * @param allowed whether the request was accepted (and recorded)
 * @param count requests in the window, including this one when accepted
 * @param limit maximum requests per window for the tier
 * @param windowSeconds window length in seconds
 * @param resetTime when the window frees a slot (now + window when accepted,
 *                  oldest recorded request + window when rejected)
 * @param retryAfterSeconds seconds until a retry can succeed; 0 when accepted
 * @param remaining requests still available in the window
 */
public record RateLimitDecision(
        boolean allowed,
        int count,
        int limit,
        long windowSeconds,
        Instant resetTime,
        long retryAfterSeconds,
        int remaining
) {
}
