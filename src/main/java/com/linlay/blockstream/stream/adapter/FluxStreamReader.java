package com.linlay.blockstream.stream.adapter;

import com.linlay.blockstream.stream.model.ReadResult;
import org.reactivestreams.Subscription;
import reactor.core.publisher.BaseSubscriber;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bridges a push-based {@link Flux} into a {@link ProviderStreamReader}: one element is
 * requested per {@link #read()}, so the upstream never runs ahead of the consumer.
 */
public final class FluxStreamReader<R> extends BaseSubscriber<R> implements ProviderStreamReader<R> {

    private final Flux<R> source;
    private final AtomicBoolean subscribed = new AtomicBoolean(false);
    private final Object lock = new Object();

    private MonoSink<ReadResult<R>> waiter;
    private R buffered;
    private boolean completed;
    private boolean earlyDemand;
    private boolean released;
    private Throwable failure;

    public FluxStreamReader(Flux<R> source) {
        this.source = Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public Mono<ReadResult<R>> read() {
        return Mono.create(sink -> {
            synchronized (lock) {
                if (released) {
                    sink.success(ReadResult.endOfStream());
                    return;
                }
                if (buffered != null) {
                    R value = buffered;
                    buffered = null;
                    sink.success(ReadResult.of(value));
                    return;
                }
                if (failure != null) {
                    sink.error(failure);
                    return;
                }
                if (completed || isDisposed()) {
                    sink.success(ReadResult.endOfStream());
                    return;
                }
                if (waiter != null) {
                    sink.error(new IllegalStateException("concurrent read on provider stream"));
                    return;
                }
                waiter = sink;
                sink.onCancel(() -> {
                    synchronized (lock) {
                        if (waiter == sink) {
                            waiter = null;
                        }
                    }
                });
            }
            if (subscribed.compareAndSet(false, true)) {
                source.subscribe(this);
            }
            synchronized (lock) {
                if (upstream() == null) {
                    earlyDemand = true;
                    return;
                }
            }
            request(1);
        });
    }

    @Override
    public void release() {
        MonoSink<ReadResult<R>> pending;
        synchronized (lock) {
            released = true;
            pending = waiter;
            waiter = null;
            buffered = null;
        }
        dispose();
        if (pending != null) {
            pending.success(ReadResult.endOfStream());
        }
    }

    @Override
    protected void hookOnSubscribe(Subscription subscription) {
        // demand is driven by read()
        boolean requested;
        synchronized (lock) {
            requested = earlyDemand;
            earlyDemand = false;
        }
        if (requested) {
            subscription.request(1);
        }
    }

    @Override
    protected void hookOnNext(R value) {
        MonoSink<ReadResult<R>> target;
        synchronized (lock) {
            target = waiter;
            waiter = null;
            if (target == null) {
                buffered = value;
                return;
            }
        }
        target.success(ReadResult.of(value));
    }

    @Override
    protected void hookOnComplete() {
        MonoSink<ReadResult<R>> target;
        synchronized (lock) {
            completed = true;
            target = waiter;
            waiter = null;
        }
        if (target != null) {
            target.success(ReadResult.endOfStream());
        }
    }

    @Override
    protected void hookOnError(Throwable throwable) {
        MonoSink<ReadResult<R>> target;
        synchronized (lock) {
            failure = throwable;
            target = waiter;
            waiter = null;
        }
        if (target != null) {
            target.error(throwable);
        }
    }
}
