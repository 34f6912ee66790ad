package com.heystive.guard.domain;

import java.util.List;

/**
 * Outcome of one sandboxed skill run. Ephemeral: handed to the caller and not stored.
 *
 * @param skillName skill that ran
 * @param args the full argument vector, including the payload file path
 * @param exitCode process exit status
 * @param output captured standard output, trimmed
 * @param durationMs wall-clock run time
 */
public record SkillInvocationResult(
        String skillName,
        List<String> args,
        int exitCode,
        String output,
        long durationMs
) {
    public SkillInvocationResult {
        args = args == null ? List.of() : List.copyOf(args);
    }
}
