package com.heystive.guard.service.security;

import com.heystive.guard.config.security.SecurityProperties;
import com.heystive.guard.domain.SecurityEvent;
import com.heystive.guard.domain.SecurityStats;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Read-only aggregation over the security state for the audit endpoint.
 */
@Service
public class SecurityAuditService {

    private final SecurityContext context;
    private final Duration recentWindow;

    @Autowired
    public SecurityAuditService(SecurityContext context, SecurityProperties properties) {
        this(context, Duration.ofMinutes(properties.getEvents().getRecentWindowMinutes()));
    }

    SecurityAuditService(SecurityContext context, Duration recentWindow) {
        this.context = context;
        this.recentWindow = recentWindow;
    }

    public SecurityStats stats() {
        Instant cutoff = context.clock().instant().minus(recentWindow);
        List<SecurityEvent> recent = context.events().since(cutoff);
        Map<String, Long> byType = recent.stream()
                .collect(Collectors.groupingBy(e -> e.type().key(), TreeMap::new, Collectors.counting()));

        IpReputationTracker ipTracker = context.ipReputationTracker();
        return new SecurityStats(
                context.events().size(),
                recent.size(),
                byType,
                ipTracker.blockedCount(),
                context.rateLimiter().activeBuckets(),
                ipTracker.recentFailures());
    }

    /**
     * Returns the most recent events, newest last.
     */
    public List<SecurityEvent> recentEvents(int limit) {
        List<SecurityEvent> all = context.events().snapshot();
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return List.copyOf(all.subList(from, all.size()));
    }
}
