package com.phillippitts.slotwatch.config.monitor;

import com.phillippitts.slotwatch.config.properties.MonitorProperties;
import com.phillippitts.slotwatch.service.limits.CircuitBreaker;
import com.phillippitts.slotwatch.service.limits.RateLimiter;
import com.phillippitts.slotwatch.service.limits.Sleeper;
import com.phillippitts.slotwatch.service.limits.StopAwareSleeper;
import com.phillippitts.slotwatch.service.monitor.BroadcastDispatcher;
import com.phillippitts.slotwatch.service.monitor.MonitorLifecycle;
import com.phillippitts.slotwatch.service.monitor.MonitorLoop;
import com.phillippitts.slotwatch.service.monitor.MonitorLoopBuilder;
import com.phillippitts.slotwatch.service.probe.Prober;
import com.phillippitts.slotwatch.service.subscriber.SubscriberStore;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Random;

/**
 * Wires the rate limiter, circuit breaker and monitor loop from {@code monitor.*} properties.
 *
 * <p>The limiter, the breaker and the loop share one {@link Sleeper}. With
 * {@code monitor.interruptible-waits=true} it is a {@link StopAwareSleeper}, so stopping the
 * monitor also ends any interval, backoff or cooldown wait in progress.
 */
@Configuration
public class MonitorConfig {

    private final MonitorProperties monitorProperties;

    public MonitorConfig(MonitorProperties monitorProperties) {
        this.monitorProperties = monitorProperties;
    }

    @Bean
    public Sleeper monitorSleeper() {
        return monitorProperties.isInterruptibleWaits() ? new StopAwareSleeper() : Sleeper.SYSTEM;
    }

    @Bean
    public RateLimiter rateLimiter(Sleeper monitorSleeper) {
        return new RateLimiter(
                monitorProperties.getMinCheckInterval(),
                monitorProperties.getMaxCheckInterval(),
                monitorProperties.getJitterRatio(),
                new Random(),
                monitorSleeper);
    }

    @Bean
    public CircuitBreaker circuitBreaker(Sleeper monitorSleeper) {
        MonitorProperties.Resilience r = monitorProperties.getResilience();
        return new CircuitBreaker(
                r.getFailureThreshold(),
                r.getCooldownOnCaptcha(),
                r.getErrorBackoffBase(),
                r.getErrorBackoffMax(),
                new Random(),
                monitorSleeper);
    }

    @Bean
    public MonitorLoop monitorLoop(Prober prober,
                                   BroadcastDispatcher broadcastDispatcher,
                                   SubscriberStore subscriberStore,
                                   RateLimiter rateLimiter,
                                   CircuitBreaker circuitBreaker,
                                   Sleeper monitorSleeper,
                                   ApplicationEventPublisher publisher) {
        return MonitorLoopBuilder.builder()
                .prober(prober)
                .dispatcher(broadcastDispatcher)
                .registry(subscriberStore)
                .rateLimiter(rateLimiter)
                .circuitBreaker(circuitBreaker)
                .sleeper(monitorSleeper)
                .publisher(publisher)
                .intervalSeconds(monitorProperties.getCheckInterval())
                .ensureLoginOnStart(monitorProperties.isEnsureLoginOnStart())
                .build();
    }

    @Bean
    public MonitorLifecycle monitorLifecycle(MonitorLoop monitorLoop) {
        return new MonitorLifecycle(
                monitorLoop,
                monitorProperties.isAutoStart(),
                Duration.ofSeconds(monitorProperties.getShutdownTimeoutSeconds()));
    }
}
