package com.heystive.guard.exception;

/**
 * Base type for rejected session tokens. Subclasses distinguish expiry, which calls for
 * re-authentication, from a bad signature, which is treated as an attack.
 */
public abstract class SessionTokenException extends HeystiveException {

    protected SessionTokenException(String message) {
        super(message);
    }

    protected SessionTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
