/**
 * Domain models shared by the monitor core and its host surface.
 *
 * <p>All domain models are immutable (Java records or enums) and independent of the page,
 * notification and persistence mechanisms.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.slotwatch.domain.Status} - semantic page classification</li>
 *   <li>{@link com.phillippitts.slotwatch.domain.StatusSnapshot} - cached classification with timestamp</li>
 *   <li>{@link com.phillippitts.slotwatch.domain.MonitorSnapshot} - copy of monitor state for status queries</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.slotwatch.domain;
