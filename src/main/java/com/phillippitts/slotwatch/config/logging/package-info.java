/**
 * MDC (ThreadContext) setup for Log4j2.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId}, {@code method}, {@code uri} - set by
 *       {@link com.phillippitts.slotwatch.config.logging.MdcFilter} for REST calls</li>
 *   <li>{@code cycle} - monitor cycle number, set on the monitor worker and carried to
 *       notification threads by the notify executor's task decorator</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2026-10-19 09:12:04.311 [slot-monitor] {cycle=12} INFO  c.p.s.s.monitor.MonitorLoop - Status NO_SLOTS; ...
 * </pre>
 */
package com.phillippitts.slotwatch.config.logging;
