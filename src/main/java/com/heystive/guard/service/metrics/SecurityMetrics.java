package com.heystive.guard.service.metrics;

import com.heystive.guard.domain.SecurityEventType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for the security layer.
 *
 * <p>Provides:
 * <ul>
 *   <li>security event counts by type, tagged as rejection or not</li>
 *   <li>sandbox invocation counts by skill and outcome</li>
 *   <li>sandbox latency per skill</li>
 * </ul>
 *
 * <p>Exposed at /actuator/prometheus.
 */
@Component
public class SecurityMetrics {

    private static final String METRIC_PREFIX = "heystive.security";

    private final MeterRegistry registry;

    public SecurityMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementEvent(SecurityEventType type) {
        Counter.builder(METRIC_PREFIX + ".events")
                .description("Security events recorded")
                .tag("type", type.key())
                .tag("rejection", String.valueOf(type.isRejection()))
                .register(registry)
                .increment();
    }

    /**
     * @param skill skill name
     * @param outcome completed, failed, timeout or rejected
     */
    public void incrementSandboxOutcome(String skill, String outcome) {
        Counter.builder(METRIC_PREFIX + ".sandbox.invocations")
                .description("Sandboxed skill invocations by outcome")
                .tag("skill", skill)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordSandboxLatency(String skill, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".sandbox.latency")
                .description("Wall time of sandboxed skill invocations")
                .tag("skill", skill)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
