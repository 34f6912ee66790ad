package com.heystive.guard.exception;

import java.time.Instant;

/**
 * Thrown when a session token's signature is valid but its expiry has passed.
 */
public class ExpiredSignatureException extends SessionTokenException {

    private final Instant expiredAt;

    public ExpiredSignatureException(Instant expiredAt) {
        super("Session token expired at " + expiredAt);
        this.expiredAt = expiredAt;
    }

    public Instant getExpiredAt() {
        return expiredAt;
    }
}
