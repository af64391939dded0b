package io.blamechain.core.node;

import io.blamechain.core.protocol.Block;

/** Notified after a block has been stored and the head has moved to it. */
@FunctionalInterface
public interface BlockListener {
    void onBlockAppended(Block block);
}
