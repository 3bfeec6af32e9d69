package com.linlay.blockstream.block;

import java.time.Duration;

/**
 * @param throttleInterval partial-write coalescing window
 * @param abortVisible     whether an aborted stream without a recorded failure gets an error block
 * @param abortMessage     content of that error block
 */
public record BlockManagerOptions(Duration throttleInterval, boolean abortVisible, String abortMessage) {

    public static final Duration DEFAULT_THROTTLE = Duration.ofMillis(150);
    public static final String DEFAULT_ABORT_MESSAGE = "Request aborted";

    public BlockManagerOptions {
        throttleInterval = throttleInterval == null || throttleInterval.isNegative() ? DEFAULT_THROTTLE : throttleInterval;
        abortMessage = abortMessage == null || abortMessage.isBlank() ? DEFAULT_ABORT_MESSAGE : abortMessage;
    }

    public static BlockManagerOptions defaults() {
        return new BlockManagerOptions(DEFAULT_THROTTLE, false, DEFAULT_ABORT_MESSAGE);
    }
}
