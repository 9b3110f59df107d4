package com.phillippitts.slotwatch.service.metrics;

import com.phillippitts.slotwatch.domain.MonitorSnapshot;
import com.phillippitts.slotwatch.service.limits.CircuitBreaker;
import com.phillippitts.slotwatch.service.monitor.MonitorLoop;
import com.phillippitts.slotwatch.service.monitor.event.BackoffEvent;
import com.phillippitts.slotwatch.service.monitor.event.CooldownStartedEvent;
import com.phillippitts.slotwatch.service.monitor.event.CycleCompletedEvent;
import com.phillippitts.slotwatch.service.monitor.event.ProbeFailureEvent;
import com.phillippitts.slotwatch.service.monitor.event.SlotsAvailableEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Micrometer instrumentation for the monitor loop, fed by its application events.
 *
 * <p>Meters:
 * <ul>
 *   <li>{@code monitor.cycles} - cycles that produced a status, tagged by status</li>
 *   <li>{@code monitor.probe.failures} - failed cycles, tagged by operation</li>
 *   <li>{@code monitor.backoffs} - backoff waits, tagged by reason</li>
 *   <li>{@code monitor.cooldowns} - CAPTCHA cooldowns</li>
 *   <li>{@code monitor.availability.alerts} - availability broadcasts</li>
 *   <li>{@code monitor.breaker.failures} - gauge of consecutive breaker failures</li>
 * </ul>
 *
 * <p>Also logs a monitor summary every 5 minutes.
 */
@Component
public class MonitorMetrics {

    private static final Logger LOG = LogManager.getLogger(MonitorMetrics.class);
    private static final String METRIC_PREFIX = "monitor";

    private final MeterRegistry registry;
    private final MonitorLoop loop;

    public MonitorMetrics(MeterRegistry registry, CircuitBreaker breaker, MonitorLoop loop) {
        this.registry = registry;
        this.loop = loop;
        Gauge.builder(METRIC_PREFIX + ".breaker.failures", breaker, b -> b.state().failures())
                .description("Consecutive failures recorded by the circuit breaker")
                .register(registry);
    }

    @EventListener
    public void onCycle(CycleCompletedEvent e) {
        Counter.builder(METRIC_PREFIX + ".cycles")
                .description("Monitor cycles that produced a status")
                .tag("status", e.status().name())
                .register(registry)
                .increment();
    }

    @EventListener
    public void onProbeFailure(ProbeFailureEvent e) {
        Counter.builder(METRIC_PREFIX + ".probe.failures")
                .description("Monitor cycles that failed with an exception")
                .tag("operation", e.operation() == null ? "unknown" : e.operation())
                .register(registry)
                .increment();
    }

    @EventListener
    public void onBackoff(BackoffEvent e) {
        Counter.builder(METRIC_PREFIX + ".backoffs")
                .description("Backoff waits")
                .tag("reason", e.reason())
                .register(registry)
                .increment();
    }

    @EventListener
    public void onCooldown(CooldownStartedEvent e) {
        Counter.builder(METRIC_PREFIX + ".cooldowns")
                .description("CAPTCHA cooldowns entered")
                .register(registry)
                .increment();
    }

    @EventListener
    public void onSlotsAvailable(SlotsAvailableEvent e) {
        Counter.builder(METRIC_PREFIX + ".availability.alerts")
                .description("Availability notices broadcast to subscribers")
                .register(registry)
                .increment();
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logSummary() {
        MonitorSnapshot s = loop.snapshot();
        LOG.info("Monitor summary: running={}, subscribers={}, lastStatus={}, failures={}/{}, breakerOpen={}",
                s.running(), s.subscriberCount(), s.lastStatus(), s.failures(), s.threshold(), s.breakerOpen());
    }
}
