package com.heystive.guard.exception;

import java.util.List;

/**
 * Thrown when a command is rejected before execution. No process has been spawned
 * when this exception is raised.
 */
public class SecurityViolationException extends HeystiveException {

    private final List<String> command;

    public SecurityViolationException(String message, List<String> command) {
        super(message);
        this.command = command == null ? List.of() : List.copyOf(command);
    }

    public List<String> getCommand() {
        return command;
    }
}
