package com.phillippitts.slotwatch.service.limits;

/** Last waiting action taken by the {@link CircuitBreaker}. */
public enum BreakerAction {
    BACKOFF,
    COOLDOWN
}
