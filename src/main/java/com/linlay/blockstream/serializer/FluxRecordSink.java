package com.linlay.blockstream.serializer;

import reactor.core.publisher.FluxSink;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bridges the serializer to a {@link FluxSink}; the sink is ready while downstream has
 * outstanding demand, so records are produced only as fast as the subscriber requests them.
 */
public class FluxRecordSink extends AbstractRecordSink {

    private final FluxSink<byte[]> emitter;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public FluxRecordSink(FluxSink<byte[]> emitter) {
        this.emitter = emitter;
        emitter.onRequest(n -> signalReady());
    }

    @Override
    public boolean isReady() {
        return !emitter.isCancelled() && emitter.requestedFromDownstream() > 0;
    }

    @Override
    public void write(byte[] bytes) {
        emitter.next(bytes);
    }

    @Override
    public void complete() {
        if (closed.compareAndSet(false, true)) {
            emitter.complete();
        }
    }

    /**
     * No-op once completed or cancelled by downstream; completing disposes the writer, which reports back here.
     */
    @Override
    public void fail(Throwable error) {
        if (closed.compareAndSet(false, true) && !emitter.isCancelled()) {
            emitter.error(error);
        }
    }
}
