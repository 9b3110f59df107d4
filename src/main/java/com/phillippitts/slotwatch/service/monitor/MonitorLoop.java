package com.phillippitts.slotwatch.service.monitor;

import com.phillippitts.slotwatch.domain.MonitorSnapshot;
import com.phillippitts.slotwatch.domain.Status;
import com.phillippitts.slotwatch.exception.ProbeException;
import com.phillippitts.slotwatch.service.limits.BreakerState;
import com.phillippitts.slotwatch.service.limits.CircuitBreaker;
import com.phillippitts.slotwatch.service.limits.RateLimiter;
import com.phillippitts.slotwatch.service.limits.Sleeper;
import com.phillippitts.slotwatch.service.limits.StopAwareSleeper;
import com.phillippitts.slotwatch.service.monitor.event.BackoffEvent;
import com.phillippitts.slotwatch.service.monitor.event.CooldownStartedEvent;
import com.phillippitts.slotwatch.service.monitor.event.CycleCompletedEvent;
import com.phillippitts.slotwatch.service.monitor.event.ProbeFailureEvent;
import com.phillippitts.slotwatch.service.monitor.event.SlotsAvailableEvent;
import com.phillippitts.slotwatch.service.probe.Prober;
import com.phillippitts.slotwatch.service.subscriber.SubscriberRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polling state machine that watches the probed page and alerts subscribers.
 *
 * <p><b>State Machine:</b>
 * <pre>
 *   STOPPED ──start()──> RUNNING ──stop() seen at cycle boundary──> STOPPED
 * </pre>
 *
 * <p><b>Cycle:</b> refresh, wait {@link #SETTLE_DELAY}, read the status, then
 * <ul>
 *   <li>CAPTCHA or BLOCKED: record a breaker failure; a CAPTCHA at the threshold broadcasts
 *       {@link #COOLDOWN_MESSAGE} and cools down, anything else backs off</li>
 *   <li>any other status: reset the breaker, broadcast {@link #AVAILABILITY_MESSAGE} once when
 *       the previous status was NO_SLOTS and this one is not, then wait a jittered interval</li>
 * </ul>
 * An exception anywhere in the cycle counts as a breaker failure followed by a backoff. The
 * loop keeps running until {@link #stop()}; only construction can fail.
 *
 * <p><b>Threading:</b> one daemon worker per run. {@link #start()}, {@link #stop()},
 * {@link #isRunning()} and {@link #snapshot()} may be called from any thread; they share only
 * the stop flag and volatile published values with the worker.
 *
 * @see MonitorLoopBuilder
 */
public class MonitorLoop {

    private static final Logger LOG = LogManager.getLogger(MonitorLoop.class);

    /** Wait between refresh and read so the page can finish rendering. */
    public static final Duration SETTLE_DELAY = Duration.ofSeconds(5);

    public static final String COOLDOWN_MESSAGE =
            "⚠️ CAPTCHA / anti-bot detected. Pausing checks for a while.";
    public static final String AVAILABILITY_MESSAGE =
            "🎉 Appointment may be available! Check now.";

    static final String WORKER_NAME = "slot-monitor";
    static final String MDC_CYCLE = "cycle";

    private final Prober prober;
    private final BroadcastDispatcher dispatcher;
    private final SubscriberRegistry registry;
    private final RateLimiter limiter;
    private final CircuitBreaker breaker;
    private final Sleeper sleeper;
    private final ApplicationEventPublisher publisher;
    private final int intervalSeconds;
    private final boolean ensureLoginOnStart;

    private final Object lifecycleLock = new Object();
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private volatile Thread worker;
    private volatile Status lastStatus;

    // Worker-owned; null until the first successful classification of a run.
    private Boolean lastNoSlots;
    private long cycle;

    MonitorLoop(Prober prober,
                BroadcastDispatcher dispatcher,
                SubscriberRegistry registry,
                RateLimiter limiter,
                CircuitBreaker breaker,
                Sleeper sleeper,
                ApplicationEventPublisher publisher,
                int intervalSeconds,
                boolean ensureLoginOnStart) {
        this.prober = prober;
        this.dispatcher = dispatcher;
        this.registry = registry;
        this.limiter = limiter;
        this.breaker = breaker;
        this.sleeper = sleeper;
        this.publisher = publisher;
        this.intervalSeconds = intervalSeconds;
        this.ensureLoginOnStart = ensureLoginOnStart;
    }

    /**
     * Starts the worker. No-op while a worker is alive, including one that is still finishing
     * after {@link #stop()}.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (isRunning()) {
                LOG.debug("Monitor already running");
                return;
            }
            stopRequested.set(false);
            if (sleeper instanceof StopAwareSleeper stopAware) {
                stopAware.rearm();
            }
            lastNoSlots = null;
            Thread t = new Thread(this::run, WORKER_NAME);
            t.setDaemon(true);
            worker = t;
            t.start();
        }
    }

    /**
     * Requests the worker to stop after the current step. Does not wait; see {@link #join(Duration)}.
     */
    public void stop() {
        if (stopRequested.compareAndSet(false, true)) {
            LOG.info("Monitor stop requested");
        }
        if (sleeper instanceof StopAwareSleeper stopAware) {
            stopAware.release();
        }
    }

    public boolean isRunning() {
        Thread t = worker;
        return t != null && t.isAlive();
    }

    /**
     * Waits for the worker to terminate.
     *
     * @return true if no worker is alive when this method returns
     */
    public boolean join(Duration timeout) {
        Thread t = worker;
        if (t == null || t == Thread.currentThread()) {
            return !isRunning();
        }
        try {
            t.join(Math.max(1, timeout.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for monitor to stop");
        }
        if (t.isAlive()) {
            LOG.warn("Monitor did not stop within {} ms", timeout.toMillis());
            return false;
        }
        return true;
    }

    /**
     * Builds a fresh read-only copy of the monitor state.
     */
    public MonitorSnapshot snapshot() {
        BreakerState state = breaker.state();
        return new MonitorSnapshot(
                isRunning(),
                subscriberCount(),
                lastStatus,
                state.failures(),
                state.threshold(),
                state.open(),
                state.lastAction() == null ? null : state.lastAction().name());
    }

    private void run() {
        LOG.info("Monitor started (interval={}s, threshold={})", intervalSeconds, breaker.getThreshold());
        try {
            if (ensureLoginOnStart) {
                try {
                    prober.ensureLoggedIn();
                } catch (RuntimeException e) {
                    LOG.warn("Login check failed, continuing: {}", e.getMessage());
                }
            }
            while (!stopRequested.get() && !Thread.currentThread().isInterrupted()) {
                cycle++;
                ThreadContext.put(MDC_CYCLE, String.valueOf(cycle));
                try {
                    runCycle();
                } catch (RuntimeException e) {
                    onCycleFailure(e);
                } finally {
                    ThreadContext.remove(MDC_CYCLE);
                }
            }
        } finally {
            try {
                prober.close();
            } catch (RuntimeException e) {
                LOG.debug("Prober close failed: {}", e.getMessage());
            }
            LOG.info("Monitor stopped after {} cycle(s)", cycle);
        }
    }

    private void runCycle() {
        prober.refresh();
        settle();
        if (stopRequested.get()) {
            return;
        }
        Status status = prober.readStatus();
        lastStatus = status;
        publish(new CycleCompletedEvent(cycle, status, Instant.now()));

        if (status.isAntiAutomation()) {
            onAntiAutomation(status);
            return;
        }

        breaker.reset();
        boolean isNoSlots = status == Status.NO_SLOTS;
        if (Boolean.TRUE.equals(lastNoSlots) && !isNoSlots) {
            LOG.info("Status changed NO_SLOTS -> {}; notifying subscribers", status);
            int recipients = dispatcher.broadcast(AVAILABILITY_MESSAGE);
            publish(new SlotsAvailableEvent(status, recipients, Instant.now()));
        }
        lastNoSlots = isNoSlots;

        int waited = limiter.sleepWithJitter(Math.max(intervalSeconds, 1));
        LOG.info("Status {}; waited {}s before next check", status, waited);
    }

    private void onAntiAutomation(Status status) {
        breaker.recordFailure();
        int failures = breaker.state().failures();
        if (status == Status.CAPTCHA && breaker.shouldCooldown()) {
            LOG.warn("CAPTCHA with {} consecutive failures; cooling down {}s", failures, breaker.getCooldownSeconds());
            int recipients = dispatcher.broadcast(COOLDOWN_MESSAGE);
            publish(new CooldownStartedEvent(failures, breaker.getCooldownSeconds(), recipients, Instant.now()));
            breaker.cooldownSleep();
        } else {
            LOG.warn("{} detected ({} consecutive failures); backing off", status, failures);
            int seconds = breaker.backoffSleep();
            publish(new BackoffEvent(status.name(), failures, seconds, Instant.now()));
        }
    }

    private void onCycleFailure(RuntimeException e) {
        String operation = e instanceof ProbeException pe ? pe.getOperation() : e.getClass().getSimpleName();
        LOG.error("Monitor cycle failed during {}: {}", operation, e.getMessage(), e);
        publish(new ProbeFailureEvent(operation, e.getMessage(), e, Instant.now()));
        breaker.recordFailure();
        int failures = breaker.state().failures();
        int seconds = breaker.backoffSleep();
        publish(new BackoffEvent("ERROR", failures, seconds, Instant.now()));
    }

    private void settle() {
        try {
            sleeper.sleep(SETTLE_DELAY);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void publish(Object event) {
        try {
            publisher.publishEvent(event);
        } catch (RuntimeException e) {
            LOG.warn("Event listener failed for {}: {}", event.getClass().getSimpleName(), e.getMessage());
        }
    }

    private int subscriberCount() {
        try {
            return registry.all().size();
        } catch (RuntimeException e) {
            LOG.debug("Subscriber count unavailable: {}", e.getMessage());
            return 0;
        }
    }
}
