package com.heystive.guard.domain;

import java.util.Objects;
import java.util.Set;

/**
 * A known API credential. Built once at startup and never mutated.
 *
 * <p>{@link #toString()} never prints the key.
 *
 * @param name stable identifier, used as the rate-limit client id and in audit events
 * @param key the secret presented by callers
 * @param tier credential class (admin, user, local, demo)
 * @param permissions endpoint permissions granted to the tier
 * @param profile request budget for the tier
 */
public record Credential(
        String name,
        String key,
        String tier,
        Set<String> permissions,
        RateLimitProfile profile
) {
    public Credential {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(profile, "profile");
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
    }

    @Override
    public String toString() {
        return "Credential[name=" + name + ", tier=" + tier + ", permissions=" + permissions + "]";
    }
}
