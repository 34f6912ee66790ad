package com.heystive.guard.service.skill;

import java.util.Map;

/**
 * A unit of assistant behavior reachable by free-text routing or by name from a plan.
 *
 * <p>Implementations must be thread-safe; one instance serves all requests.
 */
public interface Skill {

    /**
     * @return unique skill name used in plans and direct invocations
     */
    String name();

    /**
     * Returns whether this skill should handle the given utterance.
     *
     * @param text user text, never null
     * @return true to claim the utterance
     */
    boolean canHandle(String text);

    /**
     * Handles an utterance or plan step.
     *
     * @param text user text (empty for plan steps without a {@code text} argument)
     * @param args structured arguments, never null
     * @return JSON-serializable result
     */
    Map<String, Object> handle(String text, Map<String, Object> args);

    /**
     * @return one-line description shown in the skill listing
     */
    default String description() {
        return "";
    }

    /**
     * @return permission that must be granted in the permission store, or null when none
     */
    default String requiredPermission() {
        return null;
    }
}
