package com.linlay.blockstream.block;

import reactor.core.publisher.Mono;

/**
 * Write side of block storage. Returned Monos must be lazy: nothing is written until subscription.
 */
public interface BlockPersistence {

    Mono<Void> saveBlock(Block block);

    Mono<Void> saveMessage(Message message);
}
