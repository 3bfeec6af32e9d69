package com.linlay.blockstream.serializer;

import reactor.core.publisher.Mono;

/**
 * Byte destination with a ready/full backpressure signal.
 * <p>
 * Exactly one of {@link #complete()} or {@link #fail(Throwable)} is called at the end of a write.
 */
public interface RecordSink {

    boolean isReady();

    /**
     * Completes once the sink can accept more data, immediately if it already can.
     */
    Mono<Void> onReady();

    void write(byte[] bytes);

    void complete();

    void fail(Throwable error);
}
