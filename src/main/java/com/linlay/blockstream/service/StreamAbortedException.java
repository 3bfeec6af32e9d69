package com.linlay.blockstream.service;

import com.linlay.blockstream.block.Message;
import com.linlay.blockstream.cancel.CancelReason;

import java.util.Locale;

public class StreamAbortedException extends StreamException {

    private final CancelReason reason;

    public StreamAbortedException(CancelReason reason, Message finalMessage) {
        super("Stream aborted: " + (reason == null ? "unknown" : reason.name().toLowerCase(Locale.ROOT)), finalMessage);
        this.reason = reason;
    }

    public CancelReason reason() {
        return reason;
    }
}
