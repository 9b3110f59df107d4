package com.phillippitts.slotwatch.service.monitor;

import com.phillippitts.slotwatch.exception.InvalidConfigurationException;
import com.phillippitts.slotwatch.service.limits.CircuitBreaker;
import com.phillippitts.slotwatch.service.limits.RateLimiter;
import com.phillippitts.slotwatch.service.limits.Sleeper;
import com.phillippitts.slotwatch.service.notify.Notifier;
import com.phillippitts.slotwatch.service.probe.Prober;
import com.phillippitts.slotwatch.service.subscriber.SubscriberRegistry;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Builder for {@link MonitorLoop}, which needs more collaborators than a readable constructor call.
 *
 * <p><b>Usage Examples:</b>
 * <pre>{@code
 * // Application wiring: notifications on a pool, real waits
 * MonitorLoop loop = MonitorLoopBuilder.builder()
 *     .prober(prober)
 *     .registry(subscriberStore)
 *     .dispatcher(new BroadcastDispatcher(notifier, subscriberStore, notifyExecutor))
 *     .rateLimiter(limiter)
 *     .circuitBreaker(breaker)
 *     .sleeper(new StopAwareSleeper())
 *     .publisher(publisher)
 *     .intervalSeconds(300)
 *     .build();
 *
 * // Tests: sequential sends, no waiting
 * MonitorLoop loop = MonitorLoopBuilder.builder()
 *     .prober(scripted)
 *     .registry(() -> List.of(1L, 2L))
 *     .notifier(recording)
 *     .rateLimiter(limiter)
 *     .circuitBreaker(breaker)
 *     .sleeper(Sleeper.NOOP)
 *     .build();
 * }</pre>
 *
 * <p>When no dispatcher is set, one is created from the notifier, the registry and the optional
 * notification executor.
 */
public final class MonitorLoopBuilder {

    // Required
    private Prober prober;
    private SubscriberRegistry registry;
    private RateLimiter rateLimiter;
    private CircuitBreaker circuitBreaker;

    // Either a dispatcher or a notifier
    private BroadcastDispatcher dispatcher;
    private Notifier notifier;
    private Executor notifyExecutor;

    // Optional
    private Sleeper sleeper = Sleeper.SYSTEM;
    private ApplicationEventPublisher publisher = event -> { };
    private int intervalSeconds = 300;
    private boolean ensureLoginOnStart = true;

    private MonitorLoopBuilder() {
    }

    public static MonitorLoopBuilder builder() {
        return new MonitorLoopBuilder();
    }

    /**
     * @param prober page prober (required)
     */
    public MonitorLoopBuilder prober(Prober prober) {
        this.prober = prober;
        return this;
    }

    /**
     * @param registry recipients for broadcasts and the subscriber count in snapshots (required)
     */
    public MonitorLoopBuilder registry(SubscriberRegistry registry) {
        this.registry = registry;
        return this;
    }

    public MonitorLoopBuilder rateLimiter(RateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
        return this;
    }

    public MonitorLoopBuilder circuitBreaker(CircuitBreaker circuitBreaker) {
        this.circuitBreaker = circuitBreaker;
        return this;
    }

    /**
     * Sets a ready-made dispatcher; takes precedence over {@link #notifier(Notifier)}.
     */
    public MonitorLoopBuilder dispatcher(BroadcastDispatcher dispatcher) {
        this.dispatcher = dispatcher;
        return this;
    }

    public MonitorLoopBuilder notifier(Notifier notifier) {
        this.notifier = notifier;
        return this;
    }

    /**
     * @param notifyExecutor pool for sends built from {@link #notifier(Notifier)}; null means sequential
     */
    public MonitorLoopBuilder notifyExecutor(Executor notifyExecutor) {
        this.notifyExecutor = notifyExecutor;
        return this;
    }

    /**
     * Sets the sleeper for the settle delay. Use the same instance the limiter and breaker wait
     * on, so a {@link com.phillippitts.slotwatch.service.limits.StopAwareSleeper} releases all waits.
     */
    public MonitorLoopBuilder sleeper(Sleeper sleeper) {
        this.sleeper = sleeper;
        return this;
    }

    public MonitorLoopBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    /**
     * @param intervalSeconds base interval between successful checks; values below 1 are raised to 1
     */
    public MonitorLoopBuilder intervalSeconds(int intervalSeconds) {
        this.intervalSeconds = intervalSeconds;
        return this;
    }

    public MonitorLoopBuilder ensureLoginOnStart(boolean ensureLoginOnStart) {
        this.ensureLoginOnStart = ensureLoginOnStart;
        return this;
    }

    /**
     * @throws NullPointerException if a required collaborator is missing
     * @throws InvalidConfigurationException if neither a dispatcher nor a notifier was set
     */
    public MonitorLoop build() {
        Objects.requireNonNull(prober, "prober is required");
        Objects.requireNonNull(registry, "registry is required");
        Objects.requireNonNull(rateLimiter, "rateLimiter is required");
        Objects.requireNonNull(circuitBreaker, "circuitBreaker is required");
        Objects.requireNonNull(sleeper, "sleeper is required");
        Objects.requireNonNull(publisher, "publisher is required");

        BroadcastDispatcher effectiveDispatcher = dispatcher;
        if (effectiveDispatcher == null) {
            if (notifier == null) {
                throw new InvalidConfigurationException("notifier", "a dispatcher or notifier is required");
            }
            effectiveDispatcher = new BroadcastDispatcher(notifier, registry, notifyExecutor);
        }

        return new MonitorLoop(
                prober,
                effectiveDispatcher,
                registry,
                rateLimiter,
                circuitBreaker,
                sleeper,
                publisher,
                intervalSeconds,
                ensureLoginOnStart
        );
    }
}
