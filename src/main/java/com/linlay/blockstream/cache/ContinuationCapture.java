package com.linlay.blockstream.cache;

import com.linlay.blockstream.stream.model.Chunk;

/**
 * Extracts provider continuation state from a raw chunk and stores it in a namespaced cache.
 */
public interface ContinuationCapture {

    String providerTag();

    /**
     * @return true when the chunk carried continuation state and it was stored
     */
    boolean capture(String conversationId, Chunk.Raw raw);
}
