package com.heystive.guard.exception;

/**
 * Common parent of sandbox failures that occur after a command passed validation.
 */
public abstract class SandboxException extends HeystiveException {

    private final String skillName;
    private final int exitCode;

    protected SandboxException(String message, String skillName, int exitCode, Throwable cause) {
        super(message + " (skill: " + skillName + ")", cause);
        this.skillName = skillName;
        this.exitCode = exitCode;
    }

    public String getSkillName() {
        return skillName;
    }

    public int getExitCode() {
        return exitCode;
    }
}
