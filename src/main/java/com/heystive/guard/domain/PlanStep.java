package com.heystive.guard.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of an execution plan.
 *
 * @param skill skill name
 * @param args skill arguments; may be empty, values may be null
 */
public record PlanStep(String skill, Map<String, Object> args) {

    public PlanStep {
        args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }
}
