package com.phillippitts.slotwatch.service.monitor.event;

import java.time.Instant;

/**
 * Published right before the monitor enters the CAPTCHA cooldown. The breaker clears its last
 * action when the cooldown ends, so this event is the durable record of it.
 */
public record CooldownStartedEvent(int failures, int cooldownSeconds, int recipients, Instant at) {
    public CooldownStartedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
