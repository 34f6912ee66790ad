package com.heystive.guard.service.sandbox;

import com.heystive.guard.config.sandbox.SandboxProperties;
import com.heystive.guard.exception.SecurityViolationException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides whether an argument vector may be executed. Pure predicate: no process is
 * started and no state changes, the only outcome of a bad command is the exception.
 *
 * <p>A command is rejected when:
 * <ul>
 *   <li>it is empty</li>
 *   <li>the executable's basename is not allow-listed</li>
 *   <li>the space-joined command contains a dangerous substring</li>
 *   <li>an absolute executable path lies outside the safe binary directories</li>
 *   <li>an absolute argument contains {@code ..}</li>
 * </ul>
 */
@Component
public class CommandValidator {

    private final Set<String> allowedExecutables;
    private final List<String> dangerousPatterns;
    private final List<String> safeBinaryDirs;

    @Autowired
    public CommandValidator(SandboxProperties properties) {
        this(properties.getAllowedExecutables(), properties.getDangerousPatterns(), properties.getSafeBinaryDirs());
    }

    public CommandValidator(Collection<String> allowedExecutables,
                            List<String> dangerousPatterns,
                            List<String> safeBinaryDirs) {
        this.allowedExecutables = Set.copyOf(new LinkedHashSet<>(allowedExecutables));
        this.dangerousPatterns = List.copyOf(dangerousPatterns);
        this.safeBinaryDirs = List.copyOf(safeBinaryDirs);
    }

    /**
     * @param command executable followed by its arguments
     * @throws SecurityViolationException if the command must not run
     */
    public void validate(List<String> command) {
        if (command == null || command.isEmpty()) {
            throw new SecurityViolationException("Empty command", command);
        }

        String executable = command.get(0);
        String basename = basename(executable);
        if (!allowedExecutables.contains(basename)) {
            throw new SecurityViolationException("Command not allowed: " + basename, command);
        }

        String joined = String.join(" ", command);
        for (String pattern : dangerousPatterns) {
            if (joined.contains(pattern)) {
                throw new SecurityViolationException("Dangerous pattern detected: " + pattern, command);
            }
        }

        if (executable.startsWith("/") && safeBinaryDirs.stream().noneMatch(executable::startsWith)) {
            throw new SecurityViolationException("Unsafe executable path: " + executable, command);
        }

        for (String arg : command) {
            if (arg.startsWith("/") && arg.contains("..")) {
                throw new SecurityViolationException("Path traversal detected: " + arg, command);
            }
        }
    }

    /**
     * Returns {@code true} when {@link #validate(List)} would accept the command.
     */
    public boolean isAllowed(List<String> command) {
        try {
            validate(command);
            return true;
        } catch (SecurityViolationException e) {
            return false;
        }
    }

    private static String basename(String executable) {
        int slash = executable.lastIndexOf('/');
        return slash >= 0 ? executable.substring(slash + 1) : executable;
    }
}
