package com.phillippitts.slotwatch.service.limits;

import com.phillippitts.slotwatch.exception.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerTest {

    private final List<Duration> waits = new ArrayList<>();

    private CircuitBreaker breaker(int threshold, int cooldown, int base, int max) {
        return new CircuitBreaker(threshold, cooldown, base, max, new Random(17), waits::add);
    }

    @Test
    void rejectsNonPositiveThreshold() {
        assertThatThrownBy(() -> new CircuitBreaker(0, 1800, 30, 600))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("failure-threshold");
    }

    @Test
    void rejectsNegativeDurations() {
        assertThatThrownBy(() -> new CircuitBreaker(5, -1, 30, 600))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new CircuitBreaker(5, 1800, -1, 600))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new CircuitBreaker(5, 1800, 30, -1))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void startsClosed() {
        BreakerState state = breaker(3, 10, 1, 20).state();

        assertThat(state.failures()).isZero();
        assertThat(state.threshold()).isEqualTo(3);
        assertThat(state.open()).isFalse();
        assertThat(state.lastAction()).isNull();
    }

    @Test
    void backoffDoublesPerFailureUntilCap() {
        // base=1 -> jitter is uniform(0, 0), so the sequence is exact
        CircuitBreaker cb = breaker(100, 10, 1, 20);
        List<Integer> seen = new ArrayList<>();

        for (int i = 0; i < 7; i++) {
            cb.recordFailure();
            seen.add(cb.computeBackoff());
        }

        assertThat(seen).containsExactly(1, 2, 4, 8, 16, 20, 20);
    }

    @Test
    void backoffWithoutFailuresIsBase() {
        assertThat(breaker(5, 10, 1, 20).computeBackoff()).isEqualTo(1);
    }

    @Test
    void backoffSaturatesForLargeFailureCounts() {
        CircuitBreaker cb = breaker(1_000, 10, 30, 600);
        for (int i = 0; i < 200; i++) {
            cb.recordFailure();
        }

        for (int i = 0; i < 50; i++) {
            assertThat(cb.computeBackoff()).isBetween(600, 615);
        }
    }

    @Test
    void backoffJitterIsBoundedByHalfBase() {
        CircuitBreaker cb = breaker(5, 10, 30, 600);
        cb.recordFailure();

        for (int i = 0; i < 200; i++) {
            assertThat(cb.computeBackoff()).isBetween(30, 45);
        }
    }

    @Test
    void opensAtThreshold() {
        CircuitBreaker cb = breaker(2, 10, 1, 20);

        cb.recordFailure();
        assertThat(cb.shouldCooldown()).isFalse();
        assertThat(cb.state().open()).isFalse();

        cb.recordFailure();
        assertThat(cb.shouldCooldown()).isTrue();
        assertThat(cb.state().open()).isTrue();
    }

    @Test
    void backoffSleepRecordsActionWithoutReset() {
        CircuitBreaker cb = breaker(5, 10, 1, 20);
        cb.recordFailure();
        cb.recordFailure();

        int duration = cb.backoffSleep();

        assertThat(duration).isEqualTo(2);
        assertThat(waits).containsExactly(Duration.ofSeconds(2));
        assertThat(cb.state().failures()).isEqualTo(2);
        assertThat(cb.state().lastAction()).isEqualTo(BreakerAction.BACKOFF);
    }

    @Test
    void cooldownSleepWaitsFixedCooldownThenResets() {
        CircuitBreaker cb = breaker(2, 1800, 30, 600);
        cb.recordFailure();
        cb.recordFailure();

        int duration = cb.cooldownSleep();

        assertThat(duration).isEqualTo(1800);
        assertThat(waits).containsExactly(Duration.ofSeconds(1800));
        BreakerState state = cb.state();
        assertThat(state.failures()).isZero();
        assertThat(state.open()).isFalse();
        assertThat(state.lastAction()).isNull();
    }

    @Test
    void resetClearsFailuresAndAction() {
        CircuitBreaker cb = breaker(5, 10, 1, 20);
        cb.recordFailure();
        cb.backoffSleep();

        cb.reset();

        assertThat(cb.state()).isEqualTo(new BreakerState(0, 5, false, null));
    }

    @Test
    void stateIsAnImmutableCopy() {
        CircuitBreaker cb = breaker(5, 10, 1, 20);
        BreakerState before = cb.state();

        cb.recordFailure();

        assertThat(before.failures()).isZero();
        assertThat(cb.state().failures()).isEqualTo(1);
    }

    @Test
    void breakerStateRejectsInconsistentOpenFlag() {
        assertThatThrownBy(() -> new BreakerState(3, 3, false, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BreakerState(-1, 3, false, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void interruptedWaitRestoresInterruptFlag() {
        CircuitBreaker cb = new CircuitBreaker(5, 10, 1, 20, new Random(), d -> {
            throw new InterruptedException("test");
        });

        try {
            cb.backoffSleep();

            assertThat(Thread.currentThread().isInterrupted()).isTrue();
            assertThat(cb.state().lastAction()).isEqualTo(BreakerAction.BACKOFF);
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void backoffNearIntLimitSaturatesInsteadOfWrapping() {
        CircuitBreaker breaker = new CircuitBreaker(100, 0, Integer.MAX_VALUE, Integer.MAX_VALUE,
                new Random(4), Sleeper.NOOP);

        for (int failures = 0; failures < 5; failures++) {
            assertThat(breaker.computeBackoff()).isEqualTo(Integer.MAX_VALUE);
            breaker.recordFailure();
        }
    }
}
