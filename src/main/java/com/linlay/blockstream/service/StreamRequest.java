package com.linlay.blockstream.service;

/**
 * @param idleTimeoutMs overrides {@code stream.engine.idle-timeout-ms} when not null; 0 disables
 */
public record StreamRequest(String messageId, String conversationId, Long idleTimeoutMs) {

    public StreamRequest {
        if (messageId == null || messageId.isBlank()) {
            throw new IllegalArgumentException("messageId must not be blank");
        }
        if (idleTimeoutMs != null && idleTimeoutMs < 0) {
            throw new IllegalArgumentException("idleTimeoutMs must not be negative");
        }
    }

    public StreamRequest(String messageId, String conversationId) {
        this(messageId, conversationId, null);
    }
}
