package io.blamechain.core.node;

import io.blamechain.core.protocol.ProtocolLimits;

/** Simple config holder for a local node. */
public final class NodeConfig {
    public final int difficulty;
    public final int flushThreshold;
    public final long maxMiningTries;

    public NodeConfig(int difficulty, int flushThreshold, long maxMiningTries) {
        if (difficulty < 0 || difficulty > ProtocolLimits.MAX_DIFFICULTY) {
            throw new IllegalArgumentException("difficulty must be within 0.." + ProtocolLimits.MAX_DIFFICULTY);
        }
        if (flushThreshold < 1 || flushThreshold > ProtocolLimits.MAX_ENTRIES_PER_BLOCK) {
            throw new IllegalArgumentException("flushThreshold must be within 1.." + ProtocolLimits.MAX_ENTRIES_PER_BLOCK);
        }
        if (maxMiningTries < 0) {
            throw new IllegalArgumentException("maxMiningTries must be >= 0 (0 = unbounded)");
        }
        this.difficulty = difficulty;
        this.flushThreshold = flushThreshold;
        this.maxMiningTries = maxMiningTries;
    }

    public static NodeConfig defaultLocal() {
        return new NodeConfig(
                4,      // four leading hex zeros
                3,      // entries per block
                0L      // unbounded nonce search
        );
    }

    public NodeConfig withDifficulty(int difficulty) {
        return new NodeConfig(difficulty, this.flushThreshold, this.maxMiningTries);
    }

    public NodeConfig withFlushThreshold(int flushThreshold) {
        return new NodeConfig(this.difficulty, flushThreshold, this.maxMiningTries);
    }

    public NodeConfig withMaxMiningTries(long maxMiningTries) {
        return new NodeConfig(this.difficulty, this.flushThreshold, maxMiningTries);
    }

    @Override public String toString() {
        return "NodeConfig{difficulty=" + difficulty + ", flushThreshold=" + flushThreshold
                + ", maxMiningTries=" + (maxMiningTries == 0 ? "unbounded" : maxMiningTries) + "}";
    }
}
