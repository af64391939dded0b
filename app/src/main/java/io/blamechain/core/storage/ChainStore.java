package io.blamechain.core.storage;

import io.blamechain.core.protocol.Block;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Append-only block persistence, addressed by index.
 *
 * Notes:
 * - append() only accepts the block at index == size(); nothing is ever replaced or removed.
 * - Linkage and proof-of-work are checked by the chain before append(); stores do not re-verify.
 */
public interface ChainStore {

    /** Persist the next block. Throws IllegalArgumentException if block.index() != size(). */
    void append(Block block);

    /** Fetch a block by its position. */
    Optional<Block> get(long index);

    /** Number of blocks stored (genesis included). */
    long size();

    /** Most recently appended block, if any. */
    default Optional<Block> head() {
        long size = size();
        return size == 0 ? Optional.empty() : get(size - 1);
    }

    /**
     * All blocks from genesis to head.
     * Throws IllegalStateException if a position below size() holds no block.
     */
    default List<Block> blocks() {
        long size = size();
        List<Block> out = new ArrayList<>((int) Math.min(size, Integer.MAX_VALUE));
        for (long i = 0; i < size; i++) {
            Optional<Block> blk = get(i);
            if (blk.isEmpty()) {
                throw new IllegalStateException("No block stored at index " + i + " of " + size);
            }
            out.add(blk.get());
        }
        return out;
    }
}
