package com.phillippitts.slotwatch.service.monitor;

import com.phillippitts.slotwatch.domain.MonitorSnapshot;
import com.phillippitts.slotwatch.domain.Status;
import com.phillippitts.slotwatch.service.limits.CircuitBreaker;
import com.phillippitts.slotwatch.service.limits.RateLimiter;
import com.phillippitts.slotwatch.service.limits.Sleeper;
import com.phillippitts.slotwatch.service.limits.StopAwareSleeper;
import com.phillippitts.slotwatch.service.monitor.event.BackoffEvent;
import com.phillippitts.slotwatch.service.monitor.event.CooldownStartedEvent;
import com.phillippitts.slotwatch.service.monitor.event.CycleCompletedEvent;
import com.phillippitts.slotwatch.service.monitor.event.ProbeFailureEvent;
import com.phillippitts.slotwatch.service.monitor.event.SlotsAvailableEvent;
import com.phillippitts.slotwatch.testutil.EventCapturingPublisher;
import com.phillippitts.slotwatch.testutil.RecordingNotifier;
import com.phillippitts.slotwatch.testutil.ScriptedProber;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Random;

import static com.phillippitts.slotwatch.domain.Status.BLOCKED;
import static com.phillippitts.slotwatch.domain.Status.CAPTCHA;
import static com.phillippitts.slotwatch.domain.Status.MAYBE_SLOTS;
import static com.phillippitts.slotwatch.domain.Status.NO_SLOTS;
import static com.phillippitts.slotwatch.domain.Status.OK;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class MonitorLoopTest {

    private static final List<Long> RECIPIENTS = List.of(1L, 2L);

    private final RecordingNotifier notifier = new RecordingNotifier();
    private final EventCapturingPublisher events = new EventCapturingPublisher();
    private ScriptedProber prober;
    private CircuitBreaker breaker;
    private MonitorLoop loop;

    @AfterEach
    void tearDown() {
        if (loop != null) {
            loop.stop();
        }
        if (prober != null) {
            prober.release();
        }
        if (loop != null) {
            loop.join(Duration.ofSeconds(5));
        }
    }

    private MonitorLoop loop(ScriptedProber scripted, int threshold) {
        this.prober = scripted;
        this.breaker = new CircuitBreaker(threshold, 1800, 1, 20, new Random(1), Sleeper.NOOP);
        this.loop = MonitorLoopBuilder.builder()
                .prober(scripted)
                .registry(() -> RECIPIENTS)
                .notifier(notifier)
                .rateLimiter(new RateLimiter(1, 1, 0.0, new Random(1), Sleeper.NOOP))
                .circuitBreaker(breaker)
                .sleeper(Sleeper.NOOP)
                .publisher(events)
                .intervalSeconds(300)
                .build();
        return loop;
    }

    private void runScript(MonitorLoop monitor) throws InterruptedException {
        monitor.start();
        assertThat(prober.awaitExhausted(5)).as("script consumed").isTrue();
    }

    @Test
    void broadcastsAvailabilityOnceWhenNoSlotsEnds() throws InterruptedException {
        runScript(loop(new ScriptedProber(NO_SLOTS, MAYBE_SLOTS), 5));

        assertThat(notifier.sent()).hasSize(2);
        assertThat(notifier.recipientsOf(MonitorLoop.AVAILABILITY_MESSAGE)).containsExactlyInAnyOrder(1L, 2L);
        List<SlotsAvailableEvent> alerts = events.eventsOf(SlotsAvailableEvent.class);
        assertThat(alerts).hasSize(1);
        assertThat(alerts.get(0).status()).isEqualTo(MAYBE_SLOTS);
        assertThat(alerts.get(0).recipients()).isEqualTo(2);
    }

    @Test
    void alertIsSentFromWorkerWithCycleInContext() throws InterruptedException {
        runScript(loop(new ScriptedProber(NO_SLOTS, MAYBE_SLOTS), 5));

        assertThat(notifier.sent())
                .allSatisfy(s -> {
                    assertThat(s.cycle()).isEqualTo("2");
                    assertThat(s.thread()).isEqualTo(MonitorLoop.WORKER_NAME);
                });
    }

    @Test
    void noAlertWithoutPriorNoSlots() throws InterruptedException {
        runScript(loop(new ScriptedProber(MAYBE_SLOTS, MAYBE_SLOTS, NO_SLOTS, NO_SLOTS), 5));

        assertThat(notifier.sent()).isEmpty();
        assertThat(events.eventsOf(SlotsAvailableEvent.class)).isEmpty();
    }

    @Test
    void okAfterNoSlotsAlsoCountsAsTransition() throws InterruptedException {
        runScript(loop(new ScriptedProber(NO_SLOTS, OK), 5));

        assertThat(notifier.recipientsOf(MonitorLoop.AVAILABILITY_MESSAGE)).containsExactlyInAnyOrder(1L, 2L);
    }

    @Test
    void antiAutomationCycleDoesNotResetTransitionMemory() throws InterruptedException {
        runScript(loop(new ScriptedProber(NO_SLOTS, BLOCKED, MAYBE_SLOTS), 5));

        assertThat(notifier.recipientsOf(MonitorLoop.AVAILABILITY_MESSAGE)).hasSize(2);
        assertThat(events.eventsOf(BackoffEvent.class))
                .extracting(BackoffEvent::reason)
                .containsExactly("BLOCKED");
    }

    @Test
    void alertsAgainAfterEachNewNoSlotsRun() throws InterruptedException {
        runScript(loop(new ScriptedProber(NO_SLOTS, MAYBE_SLOTS, MAYBE_SLOTS, NO_SLOTS, MAYBE_SLOTS), 5));

        assertThat(events.eventsOf(SlotsAvailableEvent.class)).hasSize(2);
        assertThat(notifier.recipientsOf(MonitorLoop.AVAILABILITY_MESSAGE)).hasSize(4);
    }

    @Test
    void repeatedCaptchaSendsOneCooldownNoticeAndResets() throws InterruptedException {
        runScript(loop(new ScriptedProber(CAPTCHA, CAPTCHA), 2));

        assertThat(notifier.recipientsOf(MonitorLoop.COOLDOWN_MESSAGE)).containsExactlyInAnyOrder(1L, 2L);
        assertThat(notifier.sent()).hasSize(2);

        List<CooldownStartedEvent> cooldowns = events.eventsOf(CooldownStartedEvent.class);
        assertThat(cooldowns).hasSize(1);
        assertThat(cooldowns.get(0).failures()).isEqualTo(2);
        assertThat(cooldowns.get(0).cooldownSeconds()).isEqualTo(1800);

        MonitorSnapshot snapshot = loop.snapshot();
        assertThat(snapshot.failures()).isZero();
        assertThat(snapshot.breakerOpen()).isFalse();
        assertThat(snapshot.lastAction()).isNull();
        assertThat(snapshot.lastStatus()).isEqualTo(CAPTCHA);
    }

    @Test
    void blockedBeyondThresholdKeepsBackingOff() throws InterruptedException {
        runScript(loop(new ScriptedProber(BLOCKED, BLOCKED, BLOCKED), 2));

        assertThat(notifier.sent()).isEmpty();
        assertThat(events.eventsOf(CooldownStartedEvent.class)).isEmpty();
        assertThat(events.eventsOf(BackoffEvent.class)).hasSize(3);
        MonitorSnapshot snapshot = loop.snapshot();
        assertThat(snapshot.failures()).isEqualTo(3);
        assertThat(snapshot.breakerOpen()).isTrue();
        assertThat(snapshot.lastAction()).isEqualTo("BACKOFF");
    }

    @Test
    void successfulCycleResetsFailures() throws InterruptedException {
        runScript(loop(new ScriptedProber(BLOCKED, CAPTCHA, NO_SLOTS), 5));

        assertThat(breaker.state().failures()).isZero();
        assertThat(loop.snapshot().lastStatus()).isEqualTo(NO_SLOTS);
    }

    @Test
    void probeFailuresAreCountedWhileLoopKeepsRunning() throws InterruptedException {
        runScript(loop(new ScriptedProber(
                ScriptedProber.failure("refresh"),
                ScriptedProber.failure("refresh"),
                ScriptedProber.failure("refresh")), 5));

        MonitorSnapshot snapshot = loop.snapshot();
        assertThat(snapshot.failures()).isEqualTo(3);
        assertThat(snapshot.running()).isTrue();
        assertThat(loop.isRunning()).isTrue();
        assertThat(events.eventsOf(ProbeFailureEvent.class))
                .extracting(ProbeFailureEvent::operation)
                .containsExactly("refresh", "refresh", "refresh");
        assertThat(events.eventsOf(BackoffEvent.class))
                .extracting(BackoffEvent::reason)
                .containsOnly("ERROR");
    }

    @Test
    void unexpectedRuntimeExceptionIsAbsorbed() throws InterruptedException {
        runScript(loop(new ScriptedProber(new IllegalStateException("boom"), NO_SLOTS, MAYBE_SLOTS), 5));

        assertThat(events.eventsOf(ProbeFailureEvent.class))
                .extracting(ProbeFailureEvent::operation)
                .containsExactly("IllegalStateException");
        assertThat(notifier.recipientsOf(MonitorLoop.AVAILABILITY_MESSAGE)).hasSize(2);
    }

    @Test
    void stopClosesProberExactlyOnce() throws InterruptedException {
        runScript(loop(new ScriptedProber(NO_SLOTS), 5));

        loop.stop();
        prober.release();

        assertThat(loop.join(Duration.ofSeconds(5))).isTrue();
        assertThat(loop.isRunning()).isFalse();
        assertThat(prober.closeCalls.get()).isEqualTo(1);
        assertThat(loop.snapshot().running()).isFalse();
    }

    @Test
    void loginFailureDoesNotPreventCycles() throws InterruptedException {
        runScript(loop(new ScriptedProber(NO_SLOTS).failingLogin(), 5));

        assertThat(prober.loginCalls.get()).isEqualTo(1);
        assertThat(events.eventsOf(CycleCompletedEvent.class)).hasSize(1);
    }

    @Test
    void loginCanBeSkipped() throws InterruptedException {
        prober = new ScriptedProber(NO_SLOTS);
        breaker = new CircuitBreaker(5, 1800, 1, 20, new Random(1), Sleeper.NOOP);
        loop = MonitorLoopBuilder.builder()
                .prober(prober)
                .registry(() -> RECIPIENTS)
                .notifier(notifier)
                .rateLimiter(new RateLimiter(1, 1, 0.0, new Random(1), Sleeper.NOOP))
                .circuitBreaker(breaker)
                .sleeper(Sleeper.NOOP)
                .ensureLoginOnStart(false)
                .build();

        runScript(loop);

        assertThat(prober.loginCalls.get()).isZero();
    }

    @Test
    void secondStartWhileRunningIsNoOp() throws InterruptedException {
        MonitorLoop monitor = loop(new ScriptedProber(NO_SLOTS), 5);
        monitor.start();
        monitor.start();

        assertThat(prober.awaitExhausted(5)).isTrue();
        assertThat(prober.loginCalls.get()).isEqualTo(1);
    }

    @Test
    void snapshotBeforeStart() {
        MonitorSnapshot snapshot = loop(new ScriptedProber(), 5).snapshot();

        assertThat(snapshot.running()).isFalse();
        assertThat(snapshot.subscriberCount()).isEqualTo(2);
        assertThat(snapshot.lastStatus()).isNull();
        assertThat(snapshot.failures()).isZero();
        assertThat(snapshot.threshold()).isEqualTo(5);
        assertThat(snapshot.lastAction()).isNull();
    }

    @Test
    void stopCutsShortLongIntervalWait() {
        StopAwareSleeper sleeper = new StopAwareSleeper();
        prober = new ScriptedProber(NO_SLOTS);
        loop = MonitorLoopBuilder.builder()
                .prober(prober)
                .registry(() -> RECIPIENTS)
                .notifier(notifier)
                .rateLimiter(new RateLimiter(3600, 3600, 0.0, new Random(1), sleeper))
                .circuitBreaker(new CircuitBreaker(5, 1800, 30, 600, new Random(1), sleeper))
                .sleeper(sleeper)
                .intervalSeconds(3600)
                .build();

        loop.start();
        await().atMost(5, SECONDS).until(() -> prober.refreshCalls.get() >= 1);

        loop.stop();

        assertThat(loop.join(Duration.ofSeconds(3))).isTrue();
        assertThat(prober.closeCalls.get()).isEqualTo(1);
    }

    @Test
    void canRestartAfterStop() throws InterruptedException {
        StopAwareSleeper sleeper = new StopAwareSleeper();
        prober = new ScriptedProber(NO_SLOTS, NO_SLOTS);
        loop = MonitorLoopBuilder.builder()
                .prober(prober)
                .registry(() -> RECIPIENTS)
                .notifier(notifier)
                .rateLimiter(new RateLimiter(3600, 3600, 0.0, new Random(1), sleeper))
                .circuitBreaker(new CircuitBreaker(5, 1800, 30, 600, new Random(1), sleeper))
                .sleeper(sleeper)
                .build();

        loop.start();
        await().atMost(5, SECONDS).until(() -> prober.refreshCalls.get() >= 1);
        loop.stop();
        assertThat(loop.join(Duration.ofSeconds(3))).isTrue();

        loop.start();
        await().atMost(5, SECONDS).until(() -> prober.refreshCalls.get() >= 2);

        assertThat(loop.isRunning()).isTrue();
        assertThat(sleeper.isReleased()).isFalse();
        assertThat(prober.loginCalls.get()).isEqualTo(2);
    }

    @Test
    void statusValuesAreAllHandled() {
        for (Status status : Status.values()) {
            assertThat(status.isAntiAutomation()).isEqualTo(status == CAPTCHA || status == BLOCKED);
        }
    }
}
