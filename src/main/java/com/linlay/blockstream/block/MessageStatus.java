package com.linlay.blockstream.block;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MessageStatus {
    PROCESSING,
    SUCCESS,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
