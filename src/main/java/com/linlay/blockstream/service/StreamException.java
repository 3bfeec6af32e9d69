package com.linlay.blockstream.service;

import com.linlay.blockstream.block.Message;

/**
 * A stream ended abnormally. The message has already been finalized and persisted;
 * {@link #finalMessage()} is that persisted snapshot.
 */
public abstract class StreamException extends RuntimeException {

    private final transient Message finalMessage;

    protected StreamException(String detail, Message finalMessage) {
        super(detail);
        this.finalMessage = finalMessage;
    }

    public String messageId() {
        return finalMessage.id();
    }

    public Message finalMessage() {
        return finalMessage;
    }
}
