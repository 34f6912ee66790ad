package com.heystive.guard.service.security;

import com.heystive.guard.domain.SecurityEvent;
import com.heystive.guard.domain.SecurityEventType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded in-memory audit log of security events. Only the most recent {@code capacity}
 * events are retained.
 *
 * <p>Each recorded event is also logged and, when a publisher is configured, published as a
 * Spring application event so listeners can react (metrics, throttled warnings).
 *
 * <p>When no source address is given, the {@code clientIp} value of the Log4j2
 * {@link ThreadContext} is used; {@code MdcFilter} sets it for every HTTP request.
 */
public final class SecurityEventLog {

    private static final Logger LOG = LogManager.getLogger(SecurityEventLog.class);

    /** ThreadContext key holding the caller's address. */
    public static final String CLIENT_IP_KEY = "clientIp";

    private final int capacity;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;

    private final Lock lock = new ReentrantLock();
    private final Deque<SecurityEvent> events = new ArrayDeque<>();

    /**
     * @param capacity maximum number of retained events
     * @param clock time source for event timestamps
     * @param publisher Spring event publisher (nullable)
     */
    public SecurityEventLog(int capacity, Clock clock, ApplicationEventPublisher publisher) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.clock = clock;
        this.publisher = publisher;
    }

    /**
     * Records an event attributed to the current request's client address.
     */
    public SecurityEvent record(SecurityEventType type, Map<String, String> details) {
        return record(type, ThreadContext.get(CLIENT_IP_KEY), details);
    }

    /**
     * Records an event attributed to an explicit source address.
     */
    public SecurityEvent record(SecurityEventType type, String sourceAddress, Map<String, String> details) {
        SecurityEvent event = new SecurityEvent(clock.instant(), type, sourceAddress, details);
        lock.lock();
        try {
            if (events.size() >= capacity) {
                events.pollFirst();
            }
            events.addLast(event);
        } finally {
            lock.unlock();
        }

        LOG.info("Security event: {} source={} details={}", type.key(), event.sourceAddress(), event.details());
        if (publisher != null) {
            publisher.publishEvent(event);
        }
        return event;
    }

    /**
     * Returns retained events, oldest first.
     */
    public List<SecurityEvent> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(events);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns retained events with a timestamp after {@code cutoff}, oldest first.
     */
    public List<SecurityEvent> since(Instant cutoff) {
        List<SecurityEvent> recent = new ArrayList<>();
        for (SecurityEvent event : snapshot()) {
            if (event.timestamp().isAfter(cutoff)) {
                recent.add(event);
            }
        }
        return recent;
    }

    public int size() {
        lock.lock();
        try {
            return events.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }
}
