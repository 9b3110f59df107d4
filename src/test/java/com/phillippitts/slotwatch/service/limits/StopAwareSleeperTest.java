package com.phillippitts.slotwatch.service.limits;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class StopAwareSleeperTest {

    @Test
    void releaseEndsWaitInProgress() throws InterruptedException {
        StopAwareSleeper sleeper = new StopAwareSleeper();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(1);

        Thread t = new Thread(() -> {
            started.countDown();
            try {
                sleeper.sleep(Duration.ofMinutes(10));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            finished.countDown();
        });
        t.setDaemon(true);
        t.start();
        assertThat(started.await(1, TimeUnit.SECONDS)).isTrue();

        sleeper.release();

        assertThat(finished.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(sleeper.isReleased()).isTrue();
    }

    @Test
    void waitsReturnImmediatelyWhileReleased() throws InterruptedException {
        StopAwareSleeper sleeper = new StopAwareSleeper();
        sleeper.release();

        long start = System.nanoTime();
        sleeper.sleep(Duration.ofMinutes(10));

        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(1_000);
    }

    @Test
    void rearmRestoresNormalWaiting() throws InterruptedException {
        StopAwareSleeper sleeper = new StopAwareSleeper();
        sleeper.release();
        sleeper.rearm();

        long start = System.nanoTime();
        sleeper.sleep(Duration.ofMillis(60));

        assertThat(sleeper.isReleased()).isFalse();
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isGreaterThanOrEqualTo(50);
    }

    @Test
    void zeroDurationReturnsImmediately() throws InterruptedException {
        StopAwareSleeper sleeper = new StopAwareSleeper();

        long start = System.nanoTime();
        sleeper.sleep(Duration.ZERO);

        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(1_000);
    }
}
