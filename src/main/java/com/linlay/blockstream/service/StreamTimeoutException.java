package com.linlay.blockstream.service;

import com.linlay.blockstream.block.Message;

public class StreamTimeoutException extends StreamException {

    private final long timeoutMs;

    public StreamTimeoutException(String detail, long timeoutMs, Message finalMessage) {
        super(detail, finalMessage);
        this.timeoutMs = timeoutMs;
    }

    public long timeoutMs() {
        return timeoutMs;
    }
}
