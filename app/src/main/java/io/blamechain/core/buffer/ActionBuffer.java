package io.blamechain.core.buffer;

import com.fasterxml.jackson.databind.JsonNode;
import io.blamechain.core.metrics.BlockMetrics;
import io.blamechain.core.node.Chain;
import io.blamechain.core.protocol.Block;
import io.blamechain.core.protocol.ProtocolLimits;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Batches entries into blocks:
 * - entries are kept in enqueue order, no dedup
 * - reaching flushThreshold seals the pending list into a block, at most maxEntriesPerBlock entries per block
 * - enqueue, threshold check and sealing share one lock, so batches reach the chain in order
 *
 * Pending entries live only in memory and are lost if the process dies before a flush.
 */
public final class ActionBuffer {
    private static final Logger LOG = Logger.getLogger(ActionBuffer.class.getName());

    private final Chain chain;
    private final EntryValidator validator;
    private final int flushThreshold;
    private final int maxEntriesPerBlock;
    private final List<JsonNode> pending = new ArrayList<>();

    public ActionBuffer(Chain chain, EntryValidator validator, int flushThreshold) {
        this(chain, validator, flushThreshold, ProtocolLimits.MAX_ENTRIES_PER_BLOCK);
    }

    ActionBuffer(Chain chain, EntryValidator validator, int flushThreshold, int maxEntriesPerBlock) {
        if (flushThreshold < 1) {
            throw new IllegalArgumentException("flushThreshold must be >= 1");
        }
        if (maxEntriesPerBlock < 1 || maxEntriesPerBlock > ProtocolLimits.MAX_ENTRIES_PER_BLOCK) {
            throw new IllegalArgumentException("maxEntriesPerBlock must be within 1.." + ProtocolLimits.MAX_ENTRIES_PER_BLOCK);
        }
        this.chain = chain;
        this.validator = validator;
        this.flushThreshold = flushThreshold;
        this.maxEntriesPerBlock = maxEntriesPerBlock;
    }

    /**
     * Validate and buffer one entry.
     * Returns the last mined block when this entry completed one or more batches. A backlog left by
     * earlier failures is sealed in several blocks.
     *
     * @throws EntryRejectedException if the entry is refused; nothing is buffered
     * @throws RuntimeException from the chain if sealing fails; the entry stays pending
     */
    public synchronized Optional<Block> enqueue(JsonNode entry) {
        validator.validate(entry);
        pending.add(entry.deepCopy());
        BlockMetrics.actionEnqueued();
        Block last = null;
        while (pending.size() >= flushThreshold) {
            last = seal();
        }
        return Optional.ofNullable(last);
    }

    /** Seal whatever is pending now, even below the threshold. Empty if nothing was pending. */
    public synchronized Optional<Block> flush() {
        Block last = null;
        while (!pending.isEmpty()) {
            last = seal();
        }
        return Optional.ofNullable(last);
    }

    /** Copies of the entries not yet in a block, oldest first. */
    public synchronized List<JsonNode> pending() {
        List<JsonNode> out = new ArrayList<>(pending.size());
        for (JsonNode entry : pending) out.add(entry.deepCopy());
        return out;
    }

    public synchronized int size() { return pending.size(); }

    public int flushThreshold() { return flushThreshold; }

    private Block seal() {
        List<JsonNode> head = pending.subList(0, Math.min(pending.size(), maxEntriesPerBlock));
        List<JsonNode> batch = new ArrayList<>(head);
        head.clear();
        try {
            Block block = chain.append(batch);
            LOG.fine(() -> "Flushed " + batch.size() + " entries into block " + block.index());
            return block;
        } catch (RuntimeException e) {
            // put the batch back in front, original order, and let the caller see the failure
            pending.addAll(0, batch);
            throw e;
        }
    }
}
