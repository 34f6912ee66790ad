package com.heystive.guard.exception;

/**
 * Thrown when a caller presents no credential, a malformed or blacklisted one,
 * or one that does not match the credential table.
 */
public class AuthenticationException extends HeystiveException {

    /** Machine-readable reason, e.g. {@code AUTH_MISSING} or {@code AUTH_INVALID}. */
    private final String code;

    public AuthenticationException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
