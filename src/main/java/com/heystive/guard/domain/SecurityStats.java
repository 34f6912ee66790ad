package com.heystive.guard.domain;

import java.util.Map;

/**
 * Aggregated audit view returned by the security stats endpoint.
 *
 * @param totalEvents events currently retained in the bounded log
 * @param recentEvents events within the last hour
 * @param eventTypes recent event counts keyed by event type
 * @param blockedIps addresses with an unexpired block
 * @param activeRateLimits clients with a rate-limit window
 * @param failedAttempts recent authentication failures per address
 */
public record SecurityStats(
        int totalEvents,
        int recentEvents,
        Map<String, Long> eventTypes,
        int blockedIps,
        int activeRateLimits,
        Map<String, Integer> failedAttempts
) {
}
