package com.heystive.guard.domain;

/**
 * Request budget for a credential tier: at most {@code limit} requests in any trailing
 * window of {@code windowSeconds}.
 */
public record RateLimitProfile(int limit, long windowSeconds) {

    public RateLimitProfile {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("windowSeconds must be > 0");
        }
    }
}
