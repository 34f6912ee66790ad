package com.heystive.guard.service.metrics;

import org.springframework.stereotype.Component;

/**
 * Records sandbox outcomes, tolerating a missing {@link SecurityMetrics} so the executor
 * can run in unit tests without a registry.
 */
@Component
public final class SandboxMetricsPublisher {

    /** Publisher that records nothing. */
    public static final SandboxMetricsPublisher NOOP = new SandboxMetricsPublisher(null);

    public static final String COMPLETED = "completed";
    public static final String FAILED = "failed";
    public static final String TIMEOUT = "timeout";
    public static final String REJECTED = "rejected";

    private final SecurityMetrics metrics;

    public SandboxMetricsPublisher(SecurityMetrics metrics) {
        this.metrics = metrics;
    }

    public void record(String skill, String outcome, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.incrementSandboxOutcome(skill, outcome);
        if (!REJECTED.equals(outcome)) {
            metrics.recordSandboxLatency(skill, durationNanos);
        }
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
