package com.heystive.guard.util;

/**
 * Utility methods for time conversions and elapsed time calculations.
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Rounds a millisecond duration up to whole seconds, so that a positive
     * sub-second wait is never reported as zero.
     *
     * @param millis duration in milliseconds
     * @return seconds, rounded up; 0 for non-positive input
     */
    public static long ceilSeconds(long millis) {
        if (millis <= 0) {
            return 0;
        }
        return (millis + 999) / 1000;
    }
}
