package com.linlay.blockstream.cancel;

import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Single-shot inactivity timer. Fires its callback at most once; after firing or
 * {@link #disarm()} every further call is a no-op.
 */
public final class IdleAbortTimer {

    private final Scheduler scheduler;
    private final Object lock = new Object();

    private long timeoutMs;
    private Runnable onTimeout;
    private Disposable pending;
    private long generation;
    private boolean fired;
    private boolean disarmed;

    public IdleAbortTimer(Scheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    /**
     * Starts or restarts the timer. A non-positive timeout leaves the timer disabled.
     */
    public void arm(long timeoutMs, Runnable onTimeout) {
        Objects.requireNonNull(onTimeout, "onTimeout must not be null");
        synchronized (lock) {
            if (fired || disarmed) {
                return;
            }
            this.timeoutMs = timeoutMs;
            this.onTimeout = onTimeout;
            schedule();
        }
    }

    public void reset() {
        synchronized (lock) {
            if (fired || disarmed || onTimeout == null) {
                return;
            }
            schedule();
        }
    }

    public void disarm() {
        synchronized (lock) {
            disarmed = true;
            cancelPending();
        }
    }

    public boolean hasFired() {
        synchronized (lock) {
            return fired;
        }
    }

    public boolean isActive() {
        synchronized (lock) {
            return pending != null && !fired && !disarmed;
        }
    }

    private void schedule() {
        cancelPending();
        if (timeoutMs <= 0) {
            return;
        }
        long scheduledGeneration = generation;
        pending = scheduler.schedule(() -> fire(scheduledGeneration), timeoutMs, TimeUnit.MILLISECONDS);
    }

    private void cancelPending() {
        generation++;
        if (pending != null) {
            pending.dispose();
            pending = null;
        }
    }

    private void fire(long scheduledGeneration) {
        Runnable callback;
        synchronized (lock) {
            if (fired || disarmed || scheduledGeneration != generation) {
                return;
            }
            fired = true;
            pending = null;
            callback = onTimeout;
        }
        // outside the lock: the callback usually cancels the stream, which disarms this timer
        callback.run();
    }
}
