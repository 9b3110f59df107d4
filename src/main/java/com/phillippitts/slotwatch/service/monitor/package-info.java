/**
 * The monitor loop state machine, its fan-out dispatcher and the lifecycle glue that runs it
 * inside the application context.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.slotwatch.service.monitor.MonitorLoop} - single-worker polling loop</li>
 *   <li>{@link com.phillippitts.slotwatch.service.monitor.BroadcastDispatcher} - per-recipient,
 *       fault-isolated sends</li>
 *   <li>{@link com.phillippitts.slotwatch.service.monitor.MonitorLifecycle} - start on refresh,
 *       stop and join on close</li>
 * </ul>
 *
 * <p>MDC key {@code cycle} is set on the worker for the duration of each cycle.
 */
package com.phillippitts.slotwatch.service.monitor;
