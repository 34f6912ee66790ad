package com.heystive.guard.exception;

import java.time.Duration;

/**
 * Thrown when a sandboxed skill does not exit within its timeout. The process has
 * already been killed and any partial output discarded.
 */
public class SandboxTimeoutException extends SandboxException {

    /** Exit status reported for killed skills, matching coreutils {@code timeout}. */
    public static final int TIMEOUT_EXIT_CODE = 124;

    private final Duration timeout;

    public SandboxTimeoutException(String skillName, Duration timeout) {
        super("Timeout after " + timeout.toMillis() + "ms", skillName, TIMEOUT_EXIT_CODE, null);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
