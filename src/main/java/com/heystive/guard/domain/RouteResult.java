package com.heystive.guard.domain;

import java.util.Map;

/**
 * Result of routing free text to the first matching skill.
 *
 * @param skill name of the skill that handled the text, or {@code fallback}
 * @param result skill output
 */
public record RouteResult(String skill, Map<String, Object> result) {

    public static final String FALLBACK = "fallback";

    public static RouteResult fallback() {
        return new RouteResult(FALLBACK, Map.of("message", "no matching skill"));
    }

    public boolean isFallback() {
        return FALLBACK.equals(skill);
    }
}
