package com.heystive.guard.domain;

/**
 * Response body of the permission API.
 */
public record PermissionStatus(String permission, boolean granted) {
}
