package io.blamechain.core.storage;

import io.blamechain.core.protocol.Block;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Simple in-memory chain store. Default for local nodes and tests;
 * everything is lost when the process exits.
 */
public final class InMemoryChainStore implements ChainStore {

    private final List<Block> blocks = new ArrayList<>();

    @Override
    public synchronized void append(Block block) {
        if (block == null) throw new IllegalArgumentException("block required");
        if (block.index() != blocks.size()) {
            throw new IllegalArgumentException("Expected block index " + blocks.size() + ", got " + block.index());
        }
        blocks.add(block);
    }

    @Override
    public synchronized Optional<Block> get(long index) {
        if (index < 0 || index >= blocks.size()) return Optional.empty();
        return Optional.of(blocks.get((int) index));
    }

    @Override
    public synchronized long size() {
        return blocks.size();
    }

    @Override
    public synchronized Optional<Block> head() {
        return blocks.isEmpty() ? Optional.empty() : Optional.of(blocks.get(blocks.size() - 1));
    }

    @Override
    public synchronized List<Block> blocks() {
        return List.copyOf(blocks);
    }
}
