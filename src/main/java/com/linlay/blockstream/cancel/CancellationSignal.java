package com.linlay.blockstream.cancel;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 单次取消信号。
 * <p>
 * 空闲超时、调用方取消与 provider abort 三者取并集，先到者生效；后续 cancel 调用为 no-op。
 * 订阅 {@link #whenCancelled()} 的下游只会收到一次通知。
 */
public final class CancellationSignal {

    private final AtomicReference<CancelReason> reason = new AtomicReference<>();
    private final Sinks.One<CancelReason> cancelled = Sinks.one();

    public boolean cancel(CancelReason cancelReason) {
        if (cancelReason == null) {
            throw new IllegalArgumentException("cancelReason must not be null");
        }
        if (!reason.compareAndSet(null, cancelReason)) {
            return false;
        }
        cancelled.tryEmitValue(cancelReason);
        return true;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public CancelReason reason() {
        return reason.get();
    }

    public Mono<CancelReason> whenCancelled() {
        return cancelled.asMono();
    }
}
