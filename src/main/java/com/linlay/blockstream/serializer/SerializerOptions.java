package com.linlay.blockstream.serializer;

import java.time.Duration;

/**
 * @param waitForDrain false fails fast with {@link BackpressureException} instead of suspending
 * @param drainTimeout maximum suspension per wait; null waits indefinitely
 */
public record SerializerOptions(boolean waitForDrain, Duration drainTimeout) {

    public static SerializerOptions defaults() {
        return new SerializerOptions(true, null);
    }

    public static SerializerOptions failFast() {
        return new SerializerOptions(false, null);
    }
}
