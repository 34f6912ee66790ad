package com.heystive.guard.exception;

/**
 * Thrown when a sandboxed skill exits with a non-zero status, or cannot be started.
 * The message carries a snippet of the skill's error output.
 */
public class SandboxExecutionException extends SandboxException {

    private final String errorOutput;

    public SandboxExecutionException(String message, String skillName, int exitCode,
                                     String errorOutput, Throwable cause) {
        super(message, skillName, exitCode, cause);
        this.errorOutput = errorOutput == null ? "" : errorOutput;
    }

    public String getErrorOutput() {
        return errorOutput;
    }
}
