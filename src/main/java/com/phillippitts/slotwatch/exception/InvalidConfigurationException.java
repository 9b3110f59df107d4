package com.phillippitts.slotwatch.exception;

/**
 * Thrown at construction time when a component receives settings it cannot work with
 * (bad interval bounds, jitter outside [0,1], non-positive breaker threshold).
 * This is a fatal error that prevents the monitor from starting.
 */
public class InvalidConfigurationException extends SlotWatchException {

    private final String setting;

    public InvalidConfigurationException(String setting, String message) {
        super("Invalid configuration '" + setting + "': " + message);
        this.setting = setting;
    }

    public String getSetting() {
        return setting;
    }
}
