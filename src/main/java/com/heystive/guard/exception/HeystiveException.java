package com.heystive.guard.exception;

/**
 * Base exception for all Heystive guard errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class HeystiveException extends RuntimeException {

    public HeystiveException(String message) {
        super(message);
    }

    public HeystiveException(String message, Throwable cause) {
        super(message, cause);
    }

    public HeystiveException(Throwable cause) {
        super(cause);
    }
}
