package com.linlay.blockstream.block;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable snapshot of one message block. The block manager replaces its snapshot on every
 * change, so a snapshot handed to persistence never mutates underneath the writer.
 */
public record Block(
        String id,
        String messageId,
        BlockKind kind,
        BlockStatus status,
        String content,
        Map<String, Object> attributes,
        Instant createdAt,
        Instant updatedAt
) {

    public static final String ATTR_TOOL_CALL_ID = "toolCallId";
    public static final String ATTR_TOOL_NAME = "toolName";
    public static final String ATTR_TOOL_RESULT = "result";
    public static final String ATTR_MIME_TYPE = "mimeType";
    public static final String ATTR_ERROR_KIND = "errorKind";
    public static final String ATTR_TIMEOUT_MS = "timeoutMs";
    public static final String ATTR_THINKING_MS = "thinkingMs";

    public Block {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (messageId == null || messageId.isBlank()) {
            throw new IllegalArgumentException("messageId must not be blank");
        }
        if (kind == null || status == null) {
            throw new IllegalArgumentException("kind and status must not be null");
        }
        content = content == null ? "" : content;
        attributes = attributes == null || attributes.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Block open(String messageId, BlockKind kind, BlockStatus status, String content, Instant now) {
        return new Block("blk_" + UUID.randomUUID(), messageId, kind, status, content, Map.of(), now, now);
    }

    public Block append(String fragment, Instant now) {
        if (fragment == null || fragment.isEmpty()) {
            return this;
        }
        BlockStatus next = status == BlockStatus.PENDING ? BlockStatus.STREAMING : status;
        return new Block(id, messageId, kind, next, content + fragment, attributes, createdAt, now);
    }

    public Block withStatus(BlockStatus nextStatus, Instant now) {
        return new Block(id, messageId, kind, nextStatus, content, attributes, createdAt, now);
    }

    public Block withAttribute(String key, Object value, Instant now) {
        Map<String, Object> next = new LinkedHashMap<>(attributes);
        next.put(key, value);
        return new Block(id, messageId, kind, status, content, next, createdAt, now);
    }

    @JsonIgnore
    public String toolCallId() {
        Object value = attributes.get(ATTR_TOOL_CALL_ID);
        return value == null ? null : value.toString();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }
}
