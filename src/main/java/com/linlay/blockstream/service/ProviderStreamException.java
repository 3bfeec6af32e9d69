package com.linlay.blockstream.service;

import com.linlay.blockstream.block.Message;

public class ProviderStreamException extends StreamException {

    public ProviderStreamException(String detail, Message finalMessage) {
        super(detail, finalMessage);
    }
}
