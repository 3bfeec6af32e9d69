package com.linlay.blockstream.persistence;

public class MessageNotFoundException extends RuntimeException {

    private final String messageId;

    public MessageNotFoundException(String messageId) {
        super("Message not found: " + messageId);
        this.messageId = messageId;
    }

    public String messageId() {
        return messageId;
    }
}
