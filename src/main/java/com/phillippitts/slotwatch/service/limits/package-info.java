/**
 * Pacing and failure handling for the monitor: the jittered {@link
 * com.phillippitts.slotwatch.service.limits.RateLimiter}, the {@link
 * com.phillippitts.slotwatch.service.limits.CircuitBreaker} and the {@link
 * com.phillippitts.slotwatch.service.limits.Sleeper} they wait through.
 */
package com.phillippitts.slotwatch.service.limits;
