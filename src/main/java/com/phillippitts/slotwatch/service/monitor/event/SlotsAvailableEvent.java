package com.phillippitts.slotwatch.service.monitor.event;

import com.phillippitts.slotwatch.domain.Status;

import java.time.Instant;

/**
 * Published once per NO_SLOTS to not-NO_SLOTS transition, after the availability notice was
 * dispatched.
 *
 * @param status     status that ended the NO_SLOTS run
 * @param recipients number of recipients the notice was dispatched to
 * @param at         when the transition was observed
 */
public record SlotsAvailableEvent(Status status, int recipients, Instant at) {
    public SlotsAvailableEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
