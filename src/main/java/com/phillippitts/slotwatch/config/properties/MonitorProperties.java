package com.phillippitts.slotwatch.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the monitor loop and its resilience settings.
 *
 * <p>Interval bounds, jitter and breaker values are checked by the rate limiter and circuit
 * breaker themselves; an invalid combination fails startup with
 * {@link com.phillippitts.slotwatch.exception.InvalidConfigurationException}.
 */
@ConfigurationProperties(prefix = "monitor")
@Validated
public class MonitorProperties {

    /** Start polling as soon as the application context is ready. */
    private boolean autoStart = true;

    /** Base interval between successful checks, in seconds. */
    private int checkInterval = 300;

    /** Lower bound of a drawn interval when no base is given, in seconds. */
    private int minCheckInterval = 180;

    /** Upper bound of a drawn interval when no base is given, in seconds. */
    private int maxCheckInterval = 420;

    /** Fraction of the base interval used as +/- jitter, in [0, 1]. */
    private double jitterRatio = 0.20;

    /** Run the login check once before the first cycle. */
    private boolean ensureLoginOnStart = true;

    /** Let stop() cut short in-progress waits (interval, backoff, cooldown). */
    private boolean interruptibleWaits = true;

    /** How long shutdown waits for the worker to finish. */
    @Positive(message = "Shutdown timeout must be positive")
    private int shutdownTimeoutSeconds = 5;

    @Valid
    private Resilience resilience = new Resilience();

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public int getCheckInterval() {
        return checkInterval;
    }

    public void setCheckInterval(int checkInterval) {
        this.checkInterval = checkInterval;
    }

    public int getMinCheckInterval() {
        return minCheckInterval;
    }

    public void setMinCheckInterval(int minCheckInterval) {
        this.minCheckInterval = minCheckInterval;
    }

    public int getMaxCheckInterval() {
        return maxCheckInterval;
    }

    public void setMaxCheckInterval(int maxCheckInterval) {
        this.maxCheckInterval = maxCheckInterval;
    }

    public double getJitterRatio() {
        return jitterRatio;
    }

    public void setJitterRatio(double jitterRatio) {
        this.jitterRatio = jitterRatio;
    }

    public boolean isEnsureLoginOnStart() {
        return ensureLoginOnStart;
    }

    public void setEnsureLoginOnStart(boolean ensureLoginOnStart) {
        this.ensureLoginOnStart = ensureLoginOnStart;
    }

    public boolean isInterruptibleWaits() {
        return interruptibleWaits;
    }

    public void setInterruptibleWaits(boolean interruptibleWaits) {
        this.interruptibleWaits = interruptibleWaits;
    }

    public int getShutdownTimeoutSeconds() {
        return shutdownTimeoutSeconds;
    }

    public void setShutdownTimeoutSeconds(int shutdownTimeoutSeconds) {
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
    }

    public Resilience getResilience() {
        return resilience;
    }

    public void setResilience(Resilience resilience) {
        this.resilience = resilience;
    }

    /**
     * Circuit breaker settings ({@code monitor.resilience.*}).
     */
    public static class Resilience {
        /** Consecutive CAPTCHA failures that trigger the cooldown. */
        private int failureThreshold = 5;
        /** Cooldown after repeated CAPTCHAs, in seconds. */
        private int cooldownOnCaptcha = 1800;
        private int errorBackoffBase = 30;
        private int errorBackoffMax = 600;

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public int getCooldownOnCaptcha() {
            return cooldownOnCaptcha;
        }

        public void setCooldownOnCaptcha(int cooldownOnCaptcha) {
            this.cooldownOnCaptcha = cooldownOnCaptcha;
        }

        public int getErrorBackoffBase() {
            return errorBackoffBase;
        }

        public void setErrorBackoffBase(int errorBackoffBase) {
            this.errorBackoffBase = errorBackoffBase;
        }

        public int getErrorBackoffMax() {
            return errorBackoffMax;
        }

        public void setErrorBackoffMax(int errorBackoffMax) {
            this.errorBackoffMax = errorBackoffMax;
        }
    }
}
