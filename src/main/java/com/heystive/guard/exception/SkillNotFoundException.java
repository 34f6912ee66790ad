package com.heystive.guard.exception;

/**
 * Thrown when a plan step or direct invocation names a skill that is not registered.
 */
public class SkillNotFoundException extends HeystiveException {

    private final String skillName;

    public SkillNotFoundException(String skillName) {
        super("Skill not found: " + skillName);
        this.skillName = skillName;
    }

    public String getSkillName() {
        return skillName;
    }
}
