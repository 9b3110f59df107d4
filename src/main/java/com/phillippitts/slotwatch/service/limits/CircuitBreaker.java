package com.phillippitts.slotwatch.service.limits;

import com.phillippitts.slotwatch.exception.InvalidConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Failure-count breaker with exponential backoff and a long cooldown.
 *
 * <p><b>State Machine:</b>
 * <pre>
 *     CLOSED ──(failures >= threshold)──> OPEN
 *        ^                                  │
 *        └───────── cooldownSleep() ────────┘
 * </pre>
 *
 * <p>OPEN is not terminal: {@link #cooldownSleep()} waits the fixed cooldown and resets the
 * breaker. Below the threshold callers use {@link #backoffSleep()}, whose duration doubles with
 * every consecutive failure up to {@code backoffMax}, plus up to {@code base/2} seconds of jitter.
 *
 * <p><b>Thread Safety:</b> mutated only by the monitor worker. The whole state lives in one
 * immutable {@link BreakerState} published through a volatile field, so {@link #state()} is safe
 * to call from any thread and always returns a consistent copy.
 */
public class CircuitBreaker {

    private static final Logger LOG = LogManager.getLogger(CircuitBreaker.class);

    private final int threshold;
    private final int cooldownSeconds;
    private final int backoffBase;
    private final int backoffMax;
    private final Random random;
    private final Sleeper sleeper;

    private volatile BreakerState state;

    public CircuitBreaker(int failureThreshold, int cooldownSeconds, int backoffBase, int backoffMax) {
        this(failureThreshold, cooldownSeconds, backoffBase, backoffMax, new Random(), Sleeper.SYSTEM);
    }

    public CircuitBreaker(int failureThreshold, int cooldownSeconds, int backoffBase, int backoffMax,
                          Random random, Sleeper sleeper) {
        if (failureThreshold <= 0) {
            throw new InvalidConfigurationException("failure-threshold", "must be > 0, got " + failureThreshold);
        }
        if (cooldownSeconds < 0) {
            throw new InvalidConfigurationException("cooldown-on-captcha", "must be >= 0, got " + cooldownSeconds);
        }
        if (backoffBase < 0) {
            throw new InvalidConfigurationException("error-backoff-base", "must be >= 0, got " + backoffBase);
        }
        if (backoffMax < 0) {
            throw new InvalidConfigurationException("error-backoff-max", "must be >= 0, got " + backoffMax);
        }
        this.threshold = failureThreshold;
        this.cooldownSeconds = cooldownSeconds;
        this.backoffBase = backoffBase;
        this.backoffMax = backoffMax;
        this.random = Objects.requireNonNull(random, "random");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.state = BreakerState.closed(failureThreshold);
    }

    /**
     * Returns a copy of the current breaker state.
     */
    public BreakerState state() {
        return state;
    }

    /** Clears the failure count and last action. */
    public void reset() {
        state = BreakerState.closed(threshold);
    }

    public void recordFailure() {
        BreakerState current = state;
        state = current.withFailures(current.failures() + 1);
    }

    public boolean shouldCooldown() {
        return state.failures() >= threshold;
    }

    /**
     * Computes {@code min(base * 2^max(0, failures-1), backoffMax) + uniform(0, floor(base/2))}.
     *
     * <p>The exponential term saturates at {@code backoffMax} instead of overflowing, and the sum
     * saturates at {@link Integer#MAX_VALUE}, so the result is non-decreasing in the failure count.
     *
     * @return backoff in seconds
     */
    public int computeBackoff() {
        int exponent = Math.max(0, state.failures() - 1);
        long scaled = backoffBase;
        for (int i = 0; i < exponent && scaled > 0 && scaled < backoffMax; i++) {
            scaled *= 2;
        }
        long exp = Math.min(scaled, backoffMax);
        int jitter = random.nextInt(backoffBase / 2 + 1);
        return (int) Math.min(exp + jitter, Integer.MAX_VALUE);
    }

    /**
     * Waits {@link #computeBackoff()} seconds and records {@link BreakerAction#BACKOFF}.
     * Does not reset the failure count.
     *
     * @return the backoff duration in seconds
     */
    public int backoffSleep() {
        int duration = computeBackoff();
        LOG.info("Backing off {}s (failures={}/{})", duration, state.failures(), threshold);
        pause(duration);
        state = state.withLastAction(BreakerAction.BACKOFF);
        return duration;
    }

    /**
     * Waits the fixed cooldown, records {@link BreakerAction#COOLDOWN}, then resets.
     *
     * <p>The reset also clears the last action, so {@link #state()} afterwards reports no action.
     * Callers that need to report the cooldown must use the return value or observe it before the
     * call returns.
     *
     * @return the cooldown duration in seconds
     */
    public int cooldownSleep() {
        LOG.warn("Breaker open (failures={}/{}); cooling down for {}s", state.failures(), threshold, cooldownSeconds);
        pause(cooldownSeconds);
        state = state.withLastAction(BreakerAction.COOLDOWN);
        reset();
        return cooldownSeconds;
    }

    public int getThreshold() {
        return threshold;
    }

    public int getCooldownSeconds() {
        return cooldownSeconds;
    }

    private void pause(int seconds) {
        try {
            sleeper.sleep(Duration.ofSeconds(seconds));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Breaker wait interrupted after scheduling {}s", seconds);
        }
    }
}
