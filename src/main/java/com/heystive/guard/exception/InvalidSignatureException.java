package com.heystive.guard.exception;

/**
 * Thrown when a session token is malformed or its signature does not verify.
 */
public class InvalidSignatureException extends SessionTokenException {

    public InvalidSignatureException(String message) {
        super(message);
    }

    public InvalidSignatureException(String message, Throwable cause) {
        super(message, cause);
    }
}
