package com.phillippitts.slotwatch.service.monitor.event;

import java.time.Instant;

/**
 * Published after each backoff wait.
 *
 * @param reason  status name (CAPTCHA, BLOCKED) or {@code ERROR} for a failed cycle
 * @param failures consecutive failures at the time of the backoff
 * @param seconds  backoff duration
 */
public record BackoffEvent(String reason, int failures, int seconds, Instant at) { }
