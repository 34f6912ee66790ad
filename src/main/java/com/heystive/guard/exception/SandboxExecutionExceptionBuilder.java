package com.heystive.guard.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link SandboxExecutionException} with contextual details.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw SandboxExecutionExceptionBuilder.create("Non-zero exit: 2")
 *         .skill("tts_speak")
 *         .exitCode(2)
 *         .durationMs(140)
 *         .errorOutput(stderrSnippet)
 *         .metadata("executable", "espeak")
 *         .build();
 * </pre>
 *
 * <p>The final message format is:
 * <pre>
 * {message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...) (skill: {skill})
 * </pre>
 */
public final class SandboxExecutionExceptionBuilder {

    private final String message;
    private String skillName;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private String errorOutput;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private SandboxExecutionExceptionBuilder(String message) {
        this.message = message;
    }

    public static SandboxExecutionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new SandboxExecutionExceptionBuilder(message);
    }

    public SandboxExecutionExceptionBuilder skill(String skillName) {
        this.skillName = skillName;
        return this;
    }

    public SandboxExecutionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public SandboxExecutionExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public SandboxExecutionExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Sets the captured error output. It is kept verbatim on the exception and
     * appended to the message as {@code stderr=...}.
     */
    public SandboxExecutionExceptionBuilder errorOutput(String errorOutput) {
        this.errorOutput = errorOutput;
        return this;
    }

    public SandboxExecutionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public SandboxExecutionException build() {
        String skill = skillName != null ? skillName : "unknown";
        int code = exitCode != null ? exitCode : -1;
        return new SandboxExecutionException(buildDetailedMessage(), skill, code, errorOutput, cause);
    }

    private String buildDetailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (exitCode != null) {
            details.put("exitCode", String.valueOf(exitCode));
        }
        if (durationMs != null) {
            details.put("durationMs", String.valueOf(durationMs));
        }
        details.putAll(metadata);
        if (errorOutput != null) {
            details.put("stderr", errorOutput);
        }
        if (details.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
