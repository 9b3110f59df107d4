package com.phillippitts.slotwatch.service.limits;

import java.time.Duration;

/**
 * Waiting primitive used by the rate limiter, circuit breaker and monitor loop.
 *
 * <p>Tests substitute {@link #NOOP} (or a recording lambda) to observe computed durations
 * without actually waiting.
 */
@FunctionalInterface
public interface Sleeper {

    /** Blocks the calling thread with {@link Thread#sleep(long)}. */
    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    /** Returns immediately. */
    Sleeper NOOP = duration -> { };

    /**
     * Waits for the given duration.
     *
     * @param duration how long to wait; zero or negative returns immediately
     * @throws InterruptedException if the waiting thread is interrupted
     */
    void sleep(Duration duration) throws InterruptedException;
}
