package com.linlay.blockstream.block;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum BlockStatus {
    PENDING,
    STREAMING,
    SUCCESS,
    ERROR;

    public boolean isTerminal() {
        return this == SUCCESS || this == ERROR;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
