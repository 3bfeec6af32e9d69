package com.linlay.blockstream.service;

import com.linlay.blockstream.cancel.CancelReason;
import com.linlay.blockstream.cancel.CancellationSignal;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-flight streams by message id, so a caller outside the pipeline can cancel one.
 */
@Component
public class ActiveStreamRegistry {

    private final Map<String, CancellationSignal> signalsByMessageId = new ConcurrentHashMap<>();

    public CancellationSignal register(String messageId) {
        String key = key(messageId);
        CancellationSignal signal = new CancellationSignal();
        CancellationSignal existed = signalsByMessageId.putIfAbsent(key, signal);
        if (existed != null) {
            throw new IllegalStateException("Stream already active for messageId=" + key);
        }
        return signal;
    }

    /**
     * Removes the entry only if it still belongs to {@code signal}.
     */
    public void unregister(String messageId, CancellationSignal signal) {
        signalsByMessageId.remove(key(messageId), signal);
    }

    public boolean isStreaming(String messageId) {
        return signalsByMessageId.containsKey(key(messageId));
    }

    public int activeCount() {
        return signalsByMessageId.size();
    }

    public CancelAck cancel(String messageId) {
        String key = key(messageId);
        CancellationSignal signal = signalsByMessageId.get(key);
        if (signal == null) {
            return new CancelAck(false, "unmatched", "No active stream for messageId=" + key);
        }
        if (!signal.cancel(CancelReason.CALLER)) {
            return new CancelAck(false, "already_cancelled",
                    "Stream for messageId=" + key + " already cancelled by " + signal.reason());
        }
        return new CancelAck(true, "accepted", "Cancel accepted for messageId=" + key);
    }

    private String key(String messageId) {
        if (!StringUtils.hasText(messageId)) {
            throw new IllegalArgumentException("messageId is required");
        }
        return messageId.trim();
    }

    public record CancelAck(
            boolean accepted,
            String status,
            String detail
    ) {
    }
}
