package com.linlay.blockstream.block;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owning aggregate of an assistant reply: ordered block references plus message-level metadata.
 * Block references are append-only.
 */
public record Message(
        String id,
        String conversationId,
        List<String> blockIds,
        MessageStatus status,
        Map<String, Object> metadata,
        Instant updatedAt
) {

    public static final String META_PROVIDER = "provider";
    public static final String META_USAGE = "usage";
    public static final String META_PROTOCOL_WARNINGS = "protocolWarnings";

    public Message {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        blockIds = blockIds == null ? List.of() : List.copyOf(blockIds);
        status = status == null ? MessageStatus.PROCESSING : status;
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Message start(String id, String conversationId, Instant now) {
        return new Message(id, conversationId, List.of(), MessageStatus.PROCESSING, Map.of(), now);
    }

    public Message withBlock(String blockId, Instant now) {
        List<String> next = new ArrayList<>(blockIds);
        next.add(blockId);
        return new Message(id, conversationId, next, status, metadata, now);
    }

    public Message withStatus(MessageStatus nextStatus, Instant now) {
        return new Message(id, conversationId, blockIds, nextStatus, metadata, now);
    }

    public Message withMetadata(String key, Object value, Instant now) {
        Map<String, Object> next = new LinkedHashMap<>(metadata);
        next.put(key, value);
        return new Message(id, conversationId, blockIds, status, next, now);
    }
}
