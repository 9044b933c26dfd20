package com.phillippitts.voicegraph.util;

import java.time.Duration;

/**
 * Elapsed time around {@link System#nanoTime()}.
 *
 * @since 1.0
 */
public final class TimeUtils {

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Calculates elapsed time since a nanosecond timestamp.
     *
     * <p>Typical usage:
     * <pre>
     * long startTime = System.nanoTime();
     * // ... process audio ...
     * Duration elapsed = TimeUtils.elapsedSince(startTime);
     * </pre>
     *
     * @param startNanos start timestamp from {@link System#nanoTime()}
     * @return elapsed duration, never negative
     */
    public static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(Math.max(0, System.nanoTime() - startNanos));
    }
}
