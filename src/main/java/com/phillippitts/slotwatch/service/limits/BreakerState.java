package com.phillippitts.slotwatch.service.limits;

/**
 * Immutable view of the circuit breaker.
 *
 * @param failures   consecutive failures recorded since the last reset
 * @param threshold  failure count at which the breaker opens
 * @param open       always {@code failures >= threshold}
 * @param lastAction last waiting action, or null after a reset
 */
public record BreakerState(
        int failures,
        int threshold,
        boolean open,
        BreakerAction lastAction
) {

    public BreakerState {
        if (failures < 0) {
            throw new IllegalArgumentException("failures must not be negative, got: " + failures);
        }
        if (open != (failures >= threshold)) {
            throw new IllegalArgumentException("open must equal failures >= threshold");
        }
    }

    static BreakerState closed(int threshold) {
        return new BreakerState(0, threshold, false, null);
    }

    BreakerState withFailures(int newFailures) {
        return new BreakerState(newFailures, threshold, newFailures >= threshold, lastAction);
    }

    BreakerState withLastAction(BreakerAction action) {
        return new BreakerState(failures, threshold, open, action);
    }
}
