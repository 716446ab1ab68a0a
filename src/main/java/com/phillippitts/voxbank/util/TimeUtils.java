package com.phillippitts.voxbank.util;

/**
 * Elapsed-time helpers for {@link System#nanoTime()} measurements.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
    }

    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }
}
