package com.linlay.blockstream.block;

import com.linlay.blockstream.stream.model.Chunk;
import com.linlay.blockstream.stream.model.ChunkType;
import com.linlay.blockstream.stream.model.ErrorKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class BlockTransitionPolicyTest {

    private final BlockTransitionPolicy policy = new BlockTransitionPolicy();

    @Test
    void everyChunkTypeShouldHaveARuleForEveryActiveKind() {
        for (ChunkType type : ChunkType.values()) {
            assertThat(policy.decide(type, null)).as("%s with no active block", type).isNotNull();
            for (BlockKind kind : BlockKind.values()) {
                assertThat(policy.decide(type, kind)).as("%s over %s", type, kind).isNotNull();
            }
        }
    }

    @Test
    void sameKindDeltasShouldContinueAndKindSwitchShouldCloseAndOpen() {
        assertThat(policy.decide(ChunkType.TEXT_DELTA, BlockKind.TEXT)).isEqualTo(BlockAction.CONTINUE);
        assertThat(policy.decide(ChunkType.REASONING_DELTA, BlockKind.REASONING)).isEqualTo(BlockAction.CONTINUE);
        assertThat(policy.decide(ChunkType.TEXT_DELTA, BlockKind.REASONING)).isEqualTo(BlockAction.CLOSE_AND_OPEN);
        assertThat(policy.decide(ChunkType.REASONING_DELTA, BlockKind.TEXT)).isEqualTo(BlockAction.CLOSE_AND_OPEN);
        assertThat(policy.decide(ChunkType.TEXT_DELTA, null)).isEqualTo(BlockAction.CLOSE_AND_OPEN);
    }

    @Test
    void structuralBoundariesShouldAlwaysOpenANewBlock() {
        assertThat(policy.decide(ChunkType.TOOL_CALL_START, BlockKind.TOOL_CALL)).isEqualTo(BlockAction.CLOSE_AND_OPEN);
        assertThat(policy.decide(ChunkType.IMAGE, BlockKind.IMAGE)).isEqualTo(BlockAction.CLOSE_AND_OPEN);
    }

    @Test
    void passthroughAndErrorsShouldNeverTouchBlocks() {
        for (BlockKind kind : BlockKind.values()) {
            assertThat(policy.decide(ChunkType.RAW, kind)).isEqualTo(BlockAction.METADATA_ONLY);
            assertThat(policy.decide(ChunkType.ERROR, kind)).isEqualTo(BlockAction.RECORD_FAILURE);
            assertThat(policy.decide(ChunkType.FINISH, kind)).isEqualTo(BlockAction.FINALIZE);
        }
    }

    @Test
    void toolChunksShouldMatchOnToolCallId() {
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        Block toolBlock = Block.open("msg_1", BlockKind.TOOL_CALL, BlockStatus.PENDING, "", now)
                .withAttribute(Block.ATTR_TOOL_CALL_ID, "call_1", now);

        assertThat(policy.decide(new Chunk.ToolCallDelta("call_1", "{"), toolBlock)).isEqualTo(BlockAction.CONTINUE);
        assertThat(policy.decide(new Chunk.ToolCallDelta("call_2", "{"), toolBlock)).isEqualTo(BlockAction.CLOSE_AND_OPEN);
        assertThat(policy.decide(new Chunk.ToolCallEnd("call_1", "ok"), toolBlock)).isEqualTo(BlockAction.APPEND_AND_CLOSE);
        assertThat(policy.decide(new Chunk.ToolCallEnd("call_2", "ok"), toolBlock)).isEqualTo(BlockAction.UPDATE_DETACHED);
        assertThat(policy.decide(new Chunk.Error(ErrorKind.PROTOCOL, "bad"), toolBlock)).isEqualTo(BlockAction.RECORD_FAILURE);
    }

    @Test
    void targetKindShouldNameTheBlockAChunkOpens() {
        assertThat(policy.targetKind(ChunkType.TEXT_DELTA)).isEqualTo(BlockKind.TEXT);
        assertThat(policy.targetKind(ChunkType.REASONING_DELTA)).isEqualTo(BlockKind.REASONING);
        assertThat(policy.targetKind(ChunkType.TOOL_CALL_START)).isEqualTo(BlockKind.TOOL_CALL);
        assertThat(policy.targetKind(ChunkType.TOOL_CALL_DELTA)).isEqualTo(BlockKind.TOOL_CALL);
        assertThat(policy.targetKind(ChunkType.IMAGE)).isEqualTo(BlockKind.IMAGE);
        assertThat(policy.targetKind(ChunkType.RAW)).isNull();
    }
}
