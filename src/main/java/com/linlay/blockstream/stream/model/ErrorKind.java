package com.linlay.blockstream.stream.model;

import java.util.Locale;

public enum ErrorKind {
    PROTOCOL,
    TIMEOUT,
    ABORT,
    PROVIDER;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
