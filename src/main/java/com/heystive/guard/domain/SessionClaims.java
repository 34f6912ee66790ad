package com.heystive.guard.domain;

import java.time.Instant;
import java.util.List;

/**
 * Claims carried by a signed session token.
 *
 * @param subject who the token was issued to
 * @param tier credential tier of the subject
 * @param permissions permissions of the subject
 * @param issuedAt issue time (second precision)
 * @param expiresAt expiry time (second precision); the token is rejected from this instant on
 */
public record SessionClaims(
        String subject,
        String tier,
        List<String> permissions,
        Instant issuedAt,
        Instant expiresAt
) {
    public SessionClaims {
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }
}
