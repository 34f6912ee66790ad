package com.heystive.guard.service.security;

import com.heystive.guard.domain.RateLimitDecision;
import com.heystive.guard.domain.RateLimitProfile;
import com.heystive.guard.domain.SecurityEventType;
import com.heystive.guard.util.TimeUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sliding-window log rate limiter keyed by client id, with one budget per credential tier.
 *
 * <p>On each check the client's timestamps at or before {@code now - window} are pruned
 * (the window edge is exclusive). If the remaining count has reached the tier limit the
 * call is rejected and <em>not</em> recorded; otherwise {@code now} is appended.
 *
 * <p><b>Thread Safety:</b> windows live in a {@link ConcurrentHashMap}; the
 * prune-check-append sequence for a client runs under that client's lock stripe, so two
 * threads can never both take the last slot.
 *
 * <p>Windows are created lazily and are not evicted; each one holds at most {@code limit}
 * timestamps.
 */
public final class RateLimiter {

    private final Clock clock;
    private final Map<String, RateLimitProfile> profiles;
    private final RateLimitProfile defaultProfile;
    private final StripedLocks locks;
    private final SecurityEventLog events;

    private final ConcurrentMap<String, Deque<Long>> windows = new ConcurrentHashMap<>();

    /**
     * @param clock time source
     * @param profiles per-tier budgets
     * @param defaultProfile budget for tiers without a profile
     * @param stripes number of lock stripes
     * @param events audit log
     */
    public RateLimiter(Clock clock,
                       Map<String, RateLimitProfile> profiles,
                       RateLimitProfile defaultProfile,
                       int stripes,
                       SecurityEventLog events) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.profiles = Map.copyOf(profiles);
        this.defaultProfile = Objects.requireNonNull(defaultProfile, "defaultProfile");
        this.locks = new StripedLocks(stripes);
        this.events = Objects.requireNonNull(events, "events");
    }

    /**
     * Checks and, when allowed, records one request for a client.
     *
     * @param clientId client identity (credential name or token subject)
     * @param tier credential tier selecting the budget
     * @return decision with count, limit, reset time and retry-after
     */
    public RateLimitDecision check(String clientId, String tier) {
        Objects.requireNonNull(clientId, "clientId");
        RateLimitProfile profile = profileFor(tier);
        long windowMillis = profile.windowSeconds() * 1000L;

        ReentrantLock lock = locks.forKey(clientId);
        RateLimitDecision decision;
        lock.lock();
        try {
            long now = clock.millis();
            Deque<Long> timestamps = windows.computeIfAbsent(clientId, k -> new ArrayDeque<>());
            long cutoff = now - windowMillis;
            while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
                timestamps.pollFirst();
            }

            int count = timestamps.size();
            if (count >= profile.limit()) {
                long oldest = timestamps.peekFirst();
                long resetAt = oldest + windowMillis;
                decision = new RateLimitDecision(false, count, profile.limit(), profile.windowSeconds(),
                        Instant.ofEpochMilli(resetAt), TimeUtils.ceilSeconds(resetAt - now), 0);
            } else {
                timestamps.addLast(now);
                decision = new RateLimitDecision(true, count + 1, profile.limit(), profile.windowSeconds(),
                        Instant.ofEpochMilli(now + windowMillis), 0, profile.limit() - count - 1);
            }
        } finally {
            lock.unlock();
        }

        if (!decision.allowed()) {
            events.record(SecurityEventType.RATE_LIMIT_EXCEEDED, Map.of(
                    "client_id", clientId,
                    "key_type", String.valueOf(tier),
                    "count", String.valueOf(decision.count()),
                    "limit", String.valueOf(decision.limit())));
        }
        return decision;
    }

    /**
     * Returns the budget applied to a tier.
     */
    public RateLimitProfile profileFor(String tier) {
        if (tier == null) {
            return defaultProfile;
        }
        return profiles.getOrDefault(tier, defaultProfile);
    }

    /** Number of clients with a rate-limit window. */
    public int activeBuckets() {
        return windows.size();
    }
}
