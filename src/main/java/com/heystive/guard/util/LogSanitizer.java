package com.heystive.guard.util;

/** Utility for privacy-safe logging of credentials and free text. */
public final class LogSanitizer {

    /** Number of leading characters of a secret that may appear in logs and audit events. */
    public static final int SECRET_PREFIX_CHARS = 10;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Returns a redacted preview of a secret: its first {@value #SECRET_PREFIX_CHARS}
     * characters followed by "...". Returns "" for null.
     */
    public static String maskSecret(String secret) {
        if (secret == null) {
            return "";
        }
        return truncate(secret, SECRET_PREFIX_CHARS) + "...";
    }
}
