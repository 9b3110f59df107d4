package com.phillippitts.slotwatch.service.limits;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link Sleeper} whose waits end early once {@link #release()} is called.
 *
 * <p>The monitor releases it on stop so that a long backoff, cooldown or interval wait does not
 * delay shutdown; probe calls themselves are never interrupted. {@link #rearm()} restores normal
 * waiting for the next run.
 */
public final class StopAwareSleeper implements Sleeper {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition releasedCondition = lock.newCondition();
    private boolean released;

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        long remaining = TimeUnit.MILLISECONDS.toNanos(Math.max(0, duration.toMillis()));
        lock.lockInterruptibly();
        try {
            while (!released && remaining > 0) {
                remaining = releasedCondition.awaitNanos(remaining);
            }
        } finally {
            lock.unlock();
        }
    }

    /** Ends all in-progress waits and makes subsequent waits return immediately. */
    public void release() {
        lock.lock();
        try {
            released = true;
            releasedCondition.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** Restores normal waiting after a {@link #release()}. */
    public void rearm() {
        lock.lock();
        try {
            released = false;
        } finally {
            lock.unlock();
        }
    }

    public boolean isReleased() {
        lock.lock();
        try {
            return released;
        } finally {
            lock.unlock();
        }
    }
}
