package com.heystive.guard.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Stages of a skill request. Each stage may only advance to the stages listed for it;
 * any rejection before {@link #EXECUTING} goes straight to {@link #FAILED}.
 *
 * <pre>
 * UNVALIDATED → RATE_CHECKED → PERMISSION_CHECKED → EXECUTING → {COMPLETED, FAILED, TIMEOUT}
 * </pre>
 */
public enum RequestStage {
    UNVALIDATED,
    RATE_CHECKED,
    PERMISSION_CHECKED,
    EXECUTING,
    COMPLETED,
    FAILED,
    TIMEOUT;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TIMEOUT;
    }

    public Set<RequestStage> successors() {
        return switch (this) {
            case UNVALIDATED -> EnumSet.of(RATE_CHECKED, FAILED);
            case RATE_CHECKED -> EnumSet.of(PERMISSION_CHECKED, FAILED);
            case PERMISSION_CHECKED -> EnumSet.of(EXECUTING, FAILED);
            case EXECUTING -> EnumSet.of(COMPLETED, FAILED, TIMEOUT);
            case COMPLETED, FAILED, TIMEOUT -> EnumSet.noneOf(RequestStage.class);
        };
    }

    public boolean canAdvanceTo(RequestStage next) {
        return successors().contains(next);
    }
}
