package com.heystive.guard.domain;

/**
 * Kinds of audit events recorded by the security layer.
 */
public enum SecurityEventType {
    MISSING_CREDENTIAL(true),
    INVALID_KEY_FORMAT(true),
    BLACKLISTED_KEY_PATTERN(true),
    VALID_API_KEY(false),
    INVALID_API_KEY(true),
    RATE_LIMIT_EXCEEDED(true),
    IP_BLOCKED(true),
    BLOCKED_IP_REJECTED(true),
    TOKEN_ISSUED(false),
    TOKEN_VALIDATED(false),
    TOKEN_EXPIRED(true),
    TOKEN_INVALID(true),
    PERMISSION_DENIED(true),
    PERMISSION_GRANTED(false),
    PERMISSION_REVOKED(false),
    COMMAND_REJECTED(true),
    SANDBOX_COMPLETED(false),
    SANDBOX_FAILED(true),
    SANDBOX_TIMEOUT(true),
    SKILL_NOT_FOUND(true);

    private final boolean rejection;

    SecurityEventType(boolean rejection) {
        this.rejection = rejection;
    }

    /** True for events that record a refused or failed request. */
    public boolean isRejection() {
        return rejection;
    }

    /** Lower-case name used in logs, metrics tags and the audit API. */
    public String key() {
        return name().toLowerCase();
    }
}
