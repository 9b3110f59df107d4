/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.slotwatch.exception.SlotWatchException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.slotwatch.exception.InvalidConfigurationException} - Thrown at
 *       construction time for unusable settings; the only error allowed to reach the caller</li>
 *   <li>{@link com.phillippitts.slotwatch.exception.ProbeException} - Thrown when a page
 *       operation fails; absorbed per cycle by the circuit breaker</li>
 *   <li>{@link com.phillippitts.slotwatch.exception.DeliveryException} - Thrown when a
 *       notification to one recipient fails; isolated per recipient</li>
 *   <li>{@link com.phillippitts.slotwatch.exception.SubscriptionNotAllowedException} - Thrown when
 *       a recipient outside the allowlist subscribes</li>
 * </ul>
 *
 * <p>All exceptions are unchecked, support exception chaining via {@code cause}, and map to
 * HTTP responses through {@code GlobalExceptionHandler} when they reach the REST boundary.
 *
 * @see com.phillippitts.slotwatch.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.slotwatch.exception;
