package com.heystive.guard.domain;

import java.util.Map;

/**
 * Per-step outcome of a plan: exactly one of {@code result} or {@code error} is set,
 * as indicated by {@code status}.
 */
public record StepResult(
        String skill,
        Map<String, Object> args,
        Status status,
        Map<String, Object> result,
        String error,
        String errorType
) {
    public enum Status { SUCCESS, ERROR }

    public static StepResult success(PlanStep step, Map<String, Object> result) {
        return new StepResult(step.skill(), step.args(), Status.SUCCESS,
                result == null ? Map.of() : result, null, null);
    }

    /**
     * @param step failed step, or null when the plan entry itself was missing
     */
    public static StepResult failure(PlanStep step, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new StepResult(step == null ? null : step.skill(), step == null ? Map.of() : step.args(),
                Status.ERROR, null, message, error.getClass().getSimpleName());
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
