package com.phillippitts.slotwatch.service.monitor.event;

import java.time.Instant;

/**
 * Published when a monitor cycle fails with an exception.
 *
 * <p>Carries technical diagnostics only; page content is never included.
 */
public record ProbeFailureEvent(String operation, String message, Throwable cause, Instant at) {
    public ProbeFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
