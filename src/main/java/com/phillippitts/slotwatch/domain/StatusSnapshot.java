package com.phillippitts.slotwatch.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable classification result cached by the prober between reads.
 *
 * @param status    classified status (must not be null)
 * @param at        when the page content was classified
 * @param rawLength length of the page content that was classified
 */
public record StatusSnapshot(
        Status status,
        Instant at,
        int rawLength
) {

    public StatusSnapshot {
        Objects.requireNonNull(status, "Status must not be null");
        Objects.requireNonNull(at, "Timestamp must not be null");
        if (rawLength < 0) {
            throw new IllegalArgumentException("Raw length must not be negative, got: " + rawLength);
        }
    }

    /**
     * @return true if this snapshot is younger than {@code ttl} at instant {@code now}
     */
    public boolean isFresh(Instant now, Duration ttl) {
        return Duration.between(at, now).compareTo(ttl) < 0;
    }
}
