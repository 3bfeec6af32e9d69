package com.linlay.blockstream.serializer;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the drain waiters for sinks whose readiness changes over time.
 */
public abstract class AbstractRecordSink implements RecordSink {

    private final Object waitersLock = new Object();
    private final List<Sinks.Empty<Void>> waiters = new ArrayList<>();

    @Override
    public Mono<Void> onReady() {
        return Mono.defer(() -> {
            if (isReady()) {
                return Mono.empty();
            }
            Sinks.Empty<Void> waiter = Sinks.empty();
            synchronized (waitersLock) {
                waiters.add(waiter);
            }
            // readiness may have flipped between the check and the registration
            if (isReady()) {
                signalReady();
            }
            return waiter.asMono();
        });
    }

    protected void signalReady() {
        List<Sinks.Empty<Void>> ready;
        synchronized (waitersLock) {
            if (waiters.isEmpty()) {
                return;
            }
            ready = new ArrayList<>(waiters);
            waiters.clear();
        }
        ready.forEach(Sinks.Empty::tryEmitEmpty);
    }
}
