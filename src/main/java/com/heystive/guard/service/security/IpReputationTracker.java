package com.heystive.guard.service.security;

import com.heystive.guard.domain.SecurityEventType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks failed authentication attempts per source address and issues temporary blocks.
 *
 * <p>Failures are counted over a trailing window (one hour by default). Reaching the hard
 * threshold (10) blocks for the hard duration (30 minutes); otherwise reaching the soft
 * threshold (5) blocks for the soft duration (15 minutes).
 *
 * <p>Expiry is lazy: an expired block is removed when {@link #isBlocked(String)} looks it up.
 * Failure histories that age out completely are dropped when read, and by a sweep that
 * {@link #trackFailure(String)} runs at most once a minute. There is no background thread.
 *
 * <p><b>Thread Safety:</b> per-address state is mutated under that address's lock stripe.
 */
public final class IpReputationTracker {

    /**
     * Thresholds and durations for blocking.
     */
    public record Policy(Duration failureWindow,
                         int softThreshold,
                         Duration softBlock,
                         int hardThreshold,
                         Duration hardBlock) {

        public static Policy defaults() {
            return new Policy(Duration.ofHours(1), 5, Duration.ofMinutes(15), 10, Duration.ofMinutes(30));
        }
    }

    private static final Duration SWEEP_INTERVAL = Duration.ofMinutes(1);

    private final Clock clock;
    private final Policy policy;
    private final StripedLocks locks;
    private final SecurityEventLog events;

    private final ConcurrentMap<String, Deque<Long>> failures = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Long> blockedUntil = new ConcurrentHashMap<>();
    private final AtomicLong lastSweepMillis;

    public IpReputationTracker(Clock clock, Policy policy, int stripes, SecurityEventLog events) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.locks = new StripedLocks(stripes);
        this.events = Objects.requireNonNull(events, "events");
        this.lastSweepMillis = new AtomicLong(clock.millis());
    }

    /**
     * Records a failed attempt and blocks the address when a threshold is reached.
     *
     * @param ip source address
     * @return true if the address is blocked as a result of this failure
     */
    public boolean trackFailure(String ip) {
        Objects.requireNonNull(ip, "ip");
        ReentrantLock lock = locks.forKey(ip);
        Duration blockFor = null;
        int count;
        long until = 0;
        lock.lock();
        try {
            long now = clock.millis();
            Deque<Long> history = failures.computeIfAbsent(ip, k -> new ArrayDeque<>());
            prune(history, now);
            history.addLast(now);
            count = history.size();

            if (count >= policy.hardThreshold()) {
                blockFor = policy.hardBlock();
            } else if (count >= policy.softThreshold()) {
                blockFor = policy.softBlock();
            }
            if (blockFor != null) {
                until = now + blockFor.toMillis();
                blockedUntil.merge(ip, until, Math::max);
            }
        } finally {
            lock.unlock();
        }
        sweepIfDue();

        if (blockFor == null) {
            return false;
        }
        events.record(SecurityEventType.IP_BLOCKED, ip, Map.of(
                "ip", ip,
                "failures", String.valueOf(count),
                "duration_minutes", String.valueOf(blockFor.toMinutes()),
                "block_until", Instant.ofEpochMilli(until).toString()));
        return true;
    }

    /**
     * Returns whether the address has an unexpired block, removing an expired one.
     */
    public boolean isBlocked(String ip) {
        return blockedUntil(ip).isPresent();
    }

    /**
     * Returns the block expiry for an address, removing the entry if it has expired.
     */
    public Optional<Instant> blockedUntil(String ip) {
        if (ip == null) {
            return Optional.empty();
        }
        return locks.withLock(ip, () -> {
            Long until = blockedUntil.get(ip);
            if (until == null) {
                return Optional.empty();
            }
            if (clock.millis() < until) {
                return Optional.of(Instant.ofEpochMilli(until));
            }
            blockedUntil.remove(ip);
            return Optional.empty();
        });
    }

    /** Number of addresses with an unexpired block. Does not purge. */
    public int blockedCount() {
        long now = clock.millis();
        int count = 0;
        for (Long until : blockedUntil.values()) {
            if (until > now) {
                count++;
            }
        }
        return count;
    }

    /**
     * Failure counts within the trailing window, per address with at least one failure.
     */
    public Map<String, Integer> recentFailures() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String ip : failures.keySet()) {
            int count = pruneEntry(ip);
            if (count > 0) {
                counts.put(ip, count);
            }
        }
        return counts;
    }

    /** Number of addresses currently holding a failure history. */
    int trackedAddresses() {
        return failures.size();
    }

    private void sweepIfDue() {
        long now = clock.millis();
        long last = lastSweepMillis.get();
        if (now - last < SWEEP_INTERVAL.toMillis() || !lastSweepMillis.compareAndSet(last, now)) {
            return;
        }
        for (String ip : failures.keySet()) {
            pruneEntry(ip);
        }
    }

    /** Prunes one history under its stripe and drops it once empty; returns the remaining size. */
    private int pruneEntry(String ip) {
        return locks.withLock(ip, () -> {
            Deque<Long> history = failures.get(ip);
            if (history == null) {
                return 0;
            }
            prune(history, clock.millis());
            if (history.isEmpty()) {
                failures.remove(ip, history);
            }
            return history.size();
        });
    }

    private void prune(Deque<Long> history, long now) {
        long cutoff = now - policy.failureWindow().toMillis();
        while (!history.isEmpty() && history.peekFirst() <= cutoff) {
            history.pollFirst();
        }
    }
}
