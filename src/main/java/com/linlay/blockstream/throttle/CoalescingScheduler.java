package com.linlay.blockstream.throttle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Trailing-edge write coalescer keyed by entity id.
 * <p>
 * Within one interval only the latest submitted value per key is written. A failed write keeps
 * its value for the next tick unless a newer value arrived meanwhile. {@link #cancel(Object)}
 * drops the pending value so a mandatory write issued by the caller is never overtaken by a
 * stale throttled one.
 */
public class CoalescingScheduler<K, V> implements Disposable {

    private static final Logger log = LoggerFactory.getLogger(CoalescingScheduler.class);

    private final long intervalMs;
    private final Scheduler scheduler;
    private final Function<V, Mono<Void>> writer;
    private final Object lock = new Object();
    private final Map<K, Slot<V>> slots = new HashMap<>();
    private boolean disposed;

    public CoalescingScheduler(Duration interval, Scheduler scheduler, Function<V, Mono<Void>> writer) {
        Objects.requireNonNull(interval, "interval must not be null");
        this.intervalMs = Math.max(0L, interval.toMillis());
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
    }

    public void submit(K key, V value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        synchronized (lock) {
            if (disposed) {
                return;
            }
            Slot<V> slot = slots.computeIfAbsent(key, ignored -> new Slot<>());
            slot.value = value;
            scheduleIfIdle(key, slot);
        }
    }

    public void cancel(K key) {
        synchronized (lock) {
            Slot<V> slot = slots.remove(key);
            if (slot != null) {
                slot.disposeTimer();
            }
        }
    }

    public int pendingCount() {
        synchronized (lock) {
            int count = 0;
            for (Slot<V> slot : slots.values()) {
                if (slot.value != null) {
                    count++;
                }
            }
            return count;
        }
    }

    @Override
    public void dispose() {
        synchronized (lock) {
            if (disposed) {
                return;
            }
            disposed = true;
            slots.values().forEach(Slot::disposeTimer);
            slots.clear();
        }
    }

    @Override
    public boolean isDisposed() {
        synchronized (lock) {
            return disposed;
        }
    }

    private void tick(K key) {
        V value;
        synchronized (lock) {
            Slot<V> slot = slots.get(key);
            if (disposed || slot == null) {
                return;
            }
            slot.armed = false;
            slot.timer = null;
            value = slot.value;
            slot.value = null;
            if (value == null) {
                slots.remove(key);
                return;
            }
        }
        Mono.defer(() -> writer.apply(value)).subscribe(
                ignored -> {
                },
                ex -> onWriteFailure(key, value, ex),
                () -> onWriteComplete(key)
        );
    }

    private void onWriteComplete(K key) {
        synchronized (lock) {
            Slot<V> slot = slots.get(key);
            if (slot != null && slot.value == null && !slot.armed) {
                slots.remove(key);
            }
        }
    }

    private void onWriteFailure(K key, V value, Throwable ex) {
        synchronized (lock) {
            Slot<V> slot = slots.get(key);
            if (disposed || slot == null) {
                log.warn("Throttled write for {} failed after cancellation, dropped: {}", key, ex.getMessage());
                return;
            }
            if (slot.value == null) {
                slot.value = value;
            }
            log.warn("Throttled write for {} failed, retrying next tick: {}", key, ex.getMessage());
            scheduleIfIdle(key, slot);
        }
    }

    private void scheduleIfIdle(K key, Slot<V> slot) {
        if (slot.armed) {
            return;
        }
        slot.armed = true;
        Disposable task = scheduler.schedule(() -> tick(key), intervalMs, TimeUnit.MILLISECONDS);
        // an immediate scheduler may already have run the tick
        if (slot.armed) {
            slot.timer = task;
        }
    }

    private static final class Slot<V> {
        private V value;
        private Disposable timer;
        private boolean armed;

        private void disposeTimer() {
            armed = false;
            if (timer != null) {
                timer.dispose();
                timer = null;
            }
        }
    }
}
