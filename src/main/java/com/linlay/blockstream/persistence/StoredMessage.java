package com.linlay.blockstream.persistence;

import com.linlay.blockstream.block.Block;
import com.linlay.blockstream.block.Message;

import java.util.List;

/**
 * A message as last persisted, with its blocks in message order.
 */
public record StoredMessage(Message message, List<Block> blocks) {

    public StoredMessage {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }
}
