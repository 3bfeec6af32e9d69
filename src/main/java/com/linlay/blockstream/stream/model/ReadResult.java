package com.linlay.blockstream.stream.model;

/**
 * One pull from a provider stream reader: either a raw event or the end-of-stream marker.
 */
public record ReadResult<R>(boolean done, R value) {

    public ReadResult {
        if (!done && value == null) {
            throw new IllegalArgumentException("value must not be null unless done");
        }
    }

    public static <R> ReadResult<R> of(R value) {
        return new ReadResult<>(false, value);
    }

    public static <R> ReadResult<R> endOfStream() {
        return new ReadResult<>(true, null);
    }
}
