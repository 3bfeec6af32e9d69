package com.linlay.blockstream.block;

import com.linlay.blockstream.stream.model.Chunk;
import com.linlay.blockstream.stream.model.ChunkType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * The "continue vs. close-and-open" decision as a table keyed by chunk type.
 * <p>
 * Each row states the action when no block is active, when the active block is the chunk's
 * own kind, and when it is any other kind. For tool-call chunks "own kind" additionally
 * requires the same tool call id.
 */
public final class BlockTransitionPolicy {

    private final Map<ChunkType, Rule> rules = new EnumMap<>(ChunkType.class);

    public BlockTransitionPolicy() {
        //   chunk type                        target kind          no active                   same kind                   other kind
        rule(ChunkType.TEXT_DELTA, BlockKind.TEXT, BlockAction.CLOSE_AND_OPEN, BlockAction.CONTINUE, BlockAction.CLOSE_AND_OPEN);
        rule(ChunkType.REASONING_DELTA, BlockKind.REASONING, BlockAction.CLOSE_AND_OPEN, BlockAction.CONTINUE, BlockAction.CLOSE_AND_OPEN);
        rule(ChunkType.TOOL_CALL_START, BlockKind.TOOL_CALL, BlockAction.CLOSE_AND_OPEN, BlockAction.CLOSE_AND_OPEN, BlockAction.CLOSE_AND_OPEN);
        rule(ChunkType.TOOL_CALL_DELTA, BlockKind.TOOL_CALL, BlockAction.CLOSE_AND_OPEN, BlockAction.CONTINUE, BlockAction.CLOSE_AND_OPEN);
        rule(ChunkType.TOOL_CALL_END, BlockKind.TOOL_CALL, BlockAction.UPDATE_DETACHED, BlockAction.APPEND_AND_CLOSE, BlockAction.UPDATE_DETACHED);
        rule(ChunkType.IMAGE, BlockKind.IMAGE, BlockAction.CLOSE_AND_OPEN, BlockAction.CLOSE_AND_OPEN, BlockAction.CLOSE_AND_OPEN);
        rule(ChunkType.RAW, null, BlockAction.METADATA_ONLY, BlockAction.METADATA_ONLY, BlockAction.METADATA_ONLY);
        rule(ChunkType.ERROR, null, BlockAction.RECORD_FAILURE, BlockAction.RECORD_FAILURE, BlockAction.RECORD_FAILURE);
        rule(ChunkType.FINISH, null, BlockAction.FINALIZE, BlockAction.FINALIZE, BlockAction.FINALIZE);
    }

    /**
     * Pure table lookup. {@code activeKind} is null when no block is active.
     */
    public BlockAction decide(ChunkType chunkType, BlockKind activeKind) {
        Rule rule = requireRule(chunkType);
        if (activeKind == null) {
            return rule.whenIdle();
        }
        return activeKind == rule.targetKind() ? rule.whenSameKind() : rule.whenOtherKind();
    }

    public BlockAction decide(Chunk chunk, Block active) {
        Objects.requireNonNull(chunk, "chunk must not be null");
        if (active == null) {
            return decide(chunk.type(), null);
        }
        Rule rule = requireRule(chunk.type());
        if (active.kind() == rule.targetKind() && rule.targetKind() == BlockKind.TOOL_CALL
                && !Objects.equals(active.toolCallId(), toolCallId(chunk))) {
            return rule.whenOtherKind();
        }
        return decide(chunk.type(), active.kind());
    }

    public BlockKind targetKind(ChunkType chunkType) {
        return requireRule(chunkType).targetKind();
    }

    private static String toolCallId(Chunk chunk) {
        if (chunk instanceof Chunk.ToolCallStart start) {
            return start.id();
        }
        if (chunk instanceof Chunk.ToolCallDelta delta) {
            return delta.id();
        }
        if (chunk instanceof Chunk.ToolCallEnd end) {
            return end.id();
        }
        return null;
    }

    private Rule requireRule(ChunkType chunkType) {
        Rule rule = rules.get(Objects.requireNonNull(chunkType, "chunkType must not be null"));
        if (rule == null) {
            throw new IllegalStateException("No transition rule for chunk type " + chunkType);
        }
        return rule;
    }

    private void rule(ChunkType chunkType, BlockKind targetKind, BlockAction whenIdle,
                      BlockAction whenSameKind, BlockAction whenOtherKind) {
        rules.put(chunkType, new Rule(targetKind, whenIdle, whenSameKind, whenOtherKind));
    }

    private record Rule(BlockKind targetKind, BlockAction whenIdle, BlockAction whenSameKind, BlockAction whenOtherKind) {
    }
}
