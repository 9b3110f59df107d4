package com.phillippitts.slotwatch.domain;

/**
 * Read-only copy of the monitor's observable state, served to status queries and health checks.
 *
 * <p>Never backed by live mutable fields: every call to {@code MonitorLoop#snapshot()} builds a new
 * instance, so concurrent readers cannot race the worker thread.
 *
 * @param running         whether the polling worker is alive
 * @param subscriberCount number of registered recipients at snapshot time
 * @param lastStatus      last classified status, or null before the first successful read
 * @param failures        consecutive breaker failures
 * @param threshold       breaker threshold
 * @param breakerOpen     true when failures reached the threshold
 * @param lastAction      last breaker action ("BACKOFF", "COOLDOWN") or null
 */
public record MonitorSnapshot(
        boolean running,
        int subscriberCount,
        Status lastStatus,
        int failures,
        int threshold,
        boolean breakerOpen,
        String lastAction
) {
}
