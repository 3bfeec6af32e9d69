package com.linlay.blockstream.model.api;

import com.linlay.blockstream.block.Block;
import com.linlay.blockstream.block.MessageStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record MessageDetailResponse(
        String messageId,
        String conversationId,
        MessageStatus status,
        boolean streaming,
        Map<String, Object> metadata,
        List<Block> blocks,
        Instant updatedAt
) {
}
