package com.phillippitts.slotwatch.service.limits;

import com.phillippitts.slotwatch.exception.InvalidConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Computes jittered wait durations within a {@code [min, max]} interval window.
 *
 * <p>Jitter keeps the probing pattern unpredictable: for a base {@code b} and ratio {@code r}
 * the wait is drawn uniformly from {@code [max(1, b - floor(b*r)), b + floor(b*r)]} seconds.
 * When no base is given it is drawn uniformly from {@code [min, max]}.
 *
 * <p>Duration computation is side-effect free; {@link #sleepWithJitter(Integer)} adds the wait
 * through the injected {@link Sleeper}.
 */
public class RateLimiter {

    private static final Logger LOG = LogManager.getLogger(RateLimiter.class);

    private final int minInterval;
    private final int maxInterval;
    private final double jitterRatio;
    private final Random random;
    private final Sleeper sleeper;

    public RateLimiter(int minInterval, int maxInterval, double jitterRatio) {
        this(minInterval, maxInterval, jitterRatio, new Random(), Sleeper.SYSTEM);
    }

    public RateLimiter(int minInterval, int maxInterval, double jitterRatio, Random random, Sleeper sleeper) {
        if (minInterval <= 0) {
            throw new InvalidConfigurationException("min-check-interval", "must be > 0, got " + minInterval);
        }
        if (maxInterval < minInterval) {
            throw new InvalidConfigurationException("max-check-interval",
                    "must be >= min-check-interval (" + minInterval + "), got " + maxInterval);
        }
        if (Double.isNaN(jitterRatio) || jitterRatio < 0.0 || jitterRatio > 1.0) {
            throw new InvalidConfigurationException("jitter-ratio", "must be within [0, 1], got " + jitterRatio);
        }
        this.minInterval = minInterval;
        this.maxInterval = maxInterval;
        this.jitterRatio = jitterRatio;
        this.random = Objects.requireNonNull(random, "random");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Returns a jittered wait in seconds around a base drawn from {@code [min, max]}.
     */
    public int computeWait() {
        return computeWait(null);
    }

    /**
     * Returns a jittered wait in seconds.
     *
     * @param base base duration in seconds, or null to draw one from {@code [min, max]}
     * @return wait in seconds, always at least 1 and saturated at {@link Integer#MAX_VALUE}
     * @throws IllegalArgumentException if base is not positive
     */
    public int computeWait(Integer base) {
        long b = base != null ? base : uniform(minInterval, maxInterval);
        if (b < 1) {
            throw new IllegalArgumentException("base must be >= 1, got " + b);
        }
        long delta = (long) Math.floor(b * jitterRatio);
        long wait = uniform(Math.max(1, b - delta), b + delta);
        return (int) Math.min(wait, Integer.MAX_VALUE);
    }

    /**
     * Computes a jittered wait and blocks for it.
     *
     * <p>An interrupted wait restores the interrupt flag and returns early; the computed
     * duration is returned either way.
     *
     * @param base base duration in seconds, or null to draw one from {@code [min, max]}
     * @return the computed wait in seconds
     */
    public int sleepWithJitter(Integer base) {
        int wait = computeWait(base);
        LOG.debug("Waiting {}s before next check (base={})", wait, base);
        try {
            sleeper.sleep(Duration.ofSeconds(wait));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Jittered wait interrupted");
        }
        return wait;
    }

    public int getMinInterval() {
        return minInterval;
    }

    public int getMaxInterval() {
        return maxInterval;
    }

    public double getJitterRatio() {
        return jitterRatio;
    }

    // Spans wider than an int come from bases near Integer.MAX_VALUE with a large jitter.
    private long uniform(long lowInclusive, long highInclusive) {
        long span = highInclusive - lowInclusive + 1;
        if (span <= Integer.MAX_VALUE) {
            return lowInclusive + random.nextInt((int) span);
        }
        return lowInclusive + random.nextLong(span);
    }
}
