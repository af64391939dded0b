package io.blamechain.core.consensus;

import io.blamechain.core.protocol.Block;
import io.blamechain.core.storage.ChainStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class ChainRules {
    private ChainRules() {}

    /**
     * Checks a freshly mined block against the current head before it is stored.
     * previous == null means the block must be the genesis block.
     */
    public static void validateNext(Block block, Block previous, ProofOfWork pow) throws IllegalArgumentException {
        List<Violation> found = new ArrayList<>();
        long expectedIndex = previous == null ? 0L : previous.index() + 1;
        String expectedLink = previous == null ? Block.GENESIS_PREVIOUS_HASH : previous.hash();
        check(block, expectedIndex, expectedLink, pow, found);
        if (!found.isEmpty()) {
            throw new IllegalArgumentException(found.get(0).message());
        }

        if (previous != null && block.timestamp() < previous.timestamp()) {
            throw new IllegalArgumentException("Timestamp before parent: " + block.timestamp() + " < " + previous.timestamp());
        }
    }

    /**
     * Walks the blocks in order from genesis, recomputing every hash.
     * Timestamps are not checked; they are expected to be non-decreasing but not enforced.
     */
    public static ChainVerification verify(List<Block> blocks, ProofOfWork pow) {
        List<Violation> violations = new ArrayList<>();
        if (blocks == null || blocks.isEmpty()) {
            return new ChainVerification(0, violations);
        }
        String expectedLink = Block.GENESIS_PREVIOUS_HASH;
        for (int i = 0; i < blocks.size(); i++) {
            Block block = blocks.get(i);
            check(block, i, expectedLink, pow, violations);
            expectedLink = block.hash();
        }
        return new ChainVerification(blocks.size(), violations);
    }

    /**
     * Same walk, reading each position from the store so that a block that is absent or cannot be
     * decoded is reported at its index instead of ending the walk early.
     */
    public static ChainVerification verify(ChainStore store, ProofOfWork pow) {
        List<Violation> violations = new ArrayList<>();
        long size = store.size();
        // null once the predecessor is unreadable; the link of the next block cannot be checked
        String expectedLink = Block.GENESIS_PREVIOUS_HASH;
        for (long i = 0; i < size; i++) {
            Optional<Block> stored;
            try {
                stored = store.get(i);
            } catch (IllegalArgumentException e) {
                violations.add(new Violation(i, Violation.Type.MALFORMED, "Stored block cannot be decoded: " + e.getMessage()));
                expectedLink = null;
                continue;
            }
            if (stored.isEmpty()) {
                violations.add(new Violation(i, Violation.Type.MISSING, "No block stored at index " + i + " of " + size));
                expectedLink = null;
                continue;
            }
            Block block = stored.get();
            check(block, i, expectedLink, pow, violations);
            expectedLink = block.hash();
        }
        return new ChainVerification(size, violations);
    }

    private static void check(Block block, long expectedIndex, String expectedLink, ProofOfWork pow, List<Violation> out) {
        if (block.index() != expectedIndex) {
            out.add(new Violation(block.index(), Violation.Type.INDEX_GAP,
                    "Bad block index: expected " + expectedIndex + ", got " + block.index()));
        }

        if (expectedLink != null && !expectedLink.equals(block.previousHash())) {
            out.add(new Violation(block.index(), Violation.Type.BROKEN_LINK,
                    expectedIndex == 0 ? "Genesis must link to the zero sentinel" : "previousHash does not match predecessor"));
        }

        String recomputed;
        try {
            recomputed = block.recomputeHash();
        } catch (IllegalArgumentException e) {
            out.add(new Violation(block.index(), Violation.Type.MALFORMED, e.getMessage()));
            return;
        }
        if (!recomputed.equals(block.hash())) {
            out.add(new Violation(block.index(), Violation.Type.HASH_MISMATCH,
                    "Stored hash " + block.hash() + " != recomputed " + recomputed));
        }

        if (!pow.meetsTarget(block.hash())) {
            out.add(new Violation(block.index(), Violation.Type.DIFFICULTY_NOT_MET,
                    "Proof-of-Work target not met (difficulty " + pow.difficulty() + ")"));
        }
    }
}
