package io.blamechain.core.node;

import io.blamechain.core.protocol.Block;
import io.blamechain.core.protocol.BlockTemplate;

import java.util.List;

/**
 * Creates the genesis template.
 * - index = 0
 * - previousHash = 64 '0' characters
 * - empty payload
 * It is mined like any other block, so every hash in the chain meets the same target.
 */
public final class GenesisBuilder {
    private GenesisBuilder(){}

    public static BlockTemplate buildTemplate(long timestamp) {
        return new BlockTemplate(0L, timestamp, List.of(), Block.GENESIS_PREVIOUS_HASH);
    }

    public static BlockTemplate buildTemplate() {
        return buildTemplate(System.currentTimeMillis());
    }
}
