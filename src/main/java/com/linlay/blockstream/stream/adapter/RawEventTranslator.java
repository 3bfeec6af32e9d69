package com.linlay.blockstream.stream.adapter;

import com.linlay.blockstream.stream.model.Chunk;

import java.util.List;

/**
 * Maps one provider-native event onto provider-agnostic chunks. Implementations may keep
 * per-stream state (open tool calls by index), so one instance serves exactly one stream.
 */
public interface RawEventTranslator<R> {

    /**
     * @throws ProtocolException when the event is malformed or of an unknown shape
     */
    List<Chunk> translate(R rawEvent);

    /**
     * True for an in-band provider abort, which short-circuits the stream.
     */
    default boolean isAbort(R rawEvent) {
        return false;
    }
}
