package com.heystive.guard.exception;

/**
 * Thrown when a caller or skill lacks the permission an operation requires.
 */
public class PermissionDeniedException extends HeystiveException {

    private final String permission;

    public PermissionDeniedException(String permission) {
        super("Permission '" + permission + "' required");
        this.permission = permission;
    }

    public PermissionDeniedException(String permission, String message) {
        super(message);
        this.permission = permission;
    }

    public String getPermission() {
        return permission;
    }
}
