package com.linlay.blockstream.stream.adapter;

import com.linlay.blockstream.stream.model.ReadResult;
import reactor.core.publisher.Mono;

/**
 * Pull-style reader over a provider's raw event stream.
 */
public interface ProviderStreamReader<R> {

    /**
     * Pulls the next raw event. Cancelling the returned Mono abandons the pull;
     * an event that arrives afterwards is kept for the next call.
     */
    Mono<ReadResult<R>> read();

    /**
     * Releases the underlying connection. Must be idempotent.
     */
    void release();
}
