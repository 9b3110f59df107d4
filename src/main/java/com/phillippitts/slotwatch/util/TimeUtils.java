package com.phillippitts.slotwatch.util;

/**
 * Elapsed-time helpers for timings taken with {@link System#nanoTime()}.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * <pre>
     * long start = System.nanoTime();
     * page.refresh();
     * LOG.debug("Refreshed in {} ms", TimeUtils.elapsedMillis(start));
     * </pre>
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }
}
