package com.linlay.blockstream.serializer;

public class SerializationException extends RuntimeException {

    private final long recordIndex;

    public SerializationException(long recordIndex, Throwable cause) {
        super("Cannot serialize record #" + recordIndex + ": " + cause.getMessage(), cause);
        this.recordIndex = recordIndex;
    }

    public long recordIndex() {
        return recordIndex;
    }
}
