package com.heystive.guard.domain;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable audit record. Details never contain full secrets.
 */
public record SecurityEvent(
        Instant timestamp,
        SecurityEventType type,
        String sourceAddress,
        Map<String, String> details
) {
    public SecurityEvent {
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        if (sourceAddress == null || sourceAddress.isBlank()) {
            sourceAddress = "unknown";
        }
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
