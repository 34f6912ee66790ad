package com.heystive.guard.service.events;

import com.heystive.guard.domain.SecurityEvent;
import com.heystive.guard.service.metrics.SecurityMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Feeds security events into metrics and logs rejections at WARN, throttled per event
 * type and source address so a hostile client cannot flood the log.
 */
@Component
class SecurityEventsListener {

    private static final Logger LOG = LogManager.getLogger(SecurityEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final SecurityMetrics metrics;
    private final Clock clock;
    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();

    SecurityEventsListener(SecurityMetrics metrics, Clock clock) {
        this.metrics = metrics;
        this.clock = clock;
    }

    @EventListener
    void onSecurityEvent(SecurityEvent event) {
        metrics.incrementEvent(event.type());
        if (event.type().isRejection() && shouldLog(event.type().key() + '-' + event.sourceAddress())) {
            LOG.warn("Security rejection: type={}, source={}, details={}",
                    event.type().key(), event.sourceAddress(), event.details());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
