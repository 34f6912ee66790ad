package com.heystive.guard.domain;

import java.util.Set;

/**
 * Identity attached to a request once it has passed the authentication chain.
 *
 * @param name credential name or token subject
 * @param tier credential tier
 * @param permissions endpoint permissions
 * @param rateLimit decision of the rate-limit check for this request
 */
public record AuthenticatedPrincipal(
        String name,
        String tier,
        Set<String> permissions,
        RateLimitDecision rateLimit
) {
    public AuthenticatedPrincipal {
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
    }

    public boolean hasPermission(String permission) {
        return permissions.contains(permission);
    }
}
