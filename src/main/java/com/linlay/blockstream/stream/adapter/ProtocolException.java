package com.linlay.blockstream.stream.adapter;

/**
 * A raw provider event that could not be translated. Terminal only when the malformed
 * event was the stream's finish signal.
 */
public class ProtocolException extends RuntimeException {

    private final boolean terminal;

    public ProtocolException(String message) {
        this(message, false, null);
    }

    public ProtocolException(String message, boolean terminal, Throwable cause) {
        super(message, cause);
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
