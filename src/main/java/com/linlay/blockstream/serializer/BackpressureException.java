package com.linlay.blockstream.serializer;

public class BackpressureException extends RuntimeException {

    public BackpressureException(String message) {
        super(message);
    }
}
