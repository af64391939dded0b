package io.blamechain.core.node;

import com.fasterxml.jackson.databind.JsonNode;
import io.blamechain.core.consensus.ChainIntegrityException;
import io.blamechain.core.consensus.ChainRules;
import io.blamechain.core.consensus.ChainVerification;
import io.blamechain.core.consensus.MiningTimeoutException;
import io.blamechain.core.consensus.ProofOfWork;
import io.blamechain.core.metrics.BlockMetrics;
import io.blamechain.core.protocol.Block;
import io.blamechain.core.protocol.BlockTemplate;
import io.blamechain.core.storage.ChainStore;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the block sequence: builds templates on top of the head, mines them, validates and stores them.
 * All mutation goes through append(), which is serialized on this instance.
 */
public final class Chain {
    private static final Logger LOG = Logger.getLogger(Chain.class.getName());

    private final ChainStore store;
    private final ProofOfWork pow;
    private final long maxTries;
    private final List<BlockListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Mines and stores the genesis block if the store is empty, otherwise verifies what is already stored.
     *
     * @throws ChainIntegrityException if an existing store does not hold a valid chain
     * @throws MiningTimeoutException if the genesis block cannot be mined within maxTries
     */
    public Chain(ChainStore store, ProofOfWork pow, long maxTries) {
        this.store = store;
        this.pow = pow;
        this.maxTries = Math.max(0L, maxTries);
        if (store.size() == 0) {
            Block genesis = mine(GenesisBuilder.buildTemplate());
            store.append(genesis);
            LOG.info(() -> "Genesis block mined: " + genesis.hash() + " (nonce " + genesis.nonce() + ")");
        } else {
            ChainVerification verification = verify();
            if (!verification.isValid()) {
                LOG.severe(() -> "Stored chain failed verification: " + verification);
                verification.throwIfInvalid();
            }
            LOG.info(() -> "Loaded " + verification.length() + " blocks, head " + head().hash());
        }
    }

    public Chain(ChainStore store, ProofOfWork pow) {
        this(store, pow, 0L);
    }

    /**
     * Seals the payload into the next block. Blocks until a nonce is found.
     *
     * @throws MiningTimeoutException if a cap is configured and exhausted; nothing is stored
     */
    public synchronized Block append(List<JsonNode> payload) {
        Block parent = head();
        long timestamp = Math.max(System.currentTimeMillis(), parent.timestamp());
        BlockTemplate template = new BlockTemplate(parent.index() + 1, timestamp, payload, parent.hash());

        Block block = mine(template);
        ChainRules.validateNext(block, parent, pow);
        store.append(block);
        LOG.fine(() -> "Appended block " + block.index() + " with " + template.entryCount()
                + " entries, nonce " + block.nonce() + ", hash " + block.hash());

        for (BlockListener listener : listeners) {
            try {
                listener.onBlockAppended(block);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Block listener failed for block " + block.index(), e);
            }
        }
        return block;
    }

    /** Recomputes every hash and link from genesis to head. */
    public ChainVerification verify() {
        return ChainRules.verify(store, pow);
    }

    /** @throws ChainIntegrityException listing every violation found */
    public void verifyOrThrow() {
        verify().throwIfInvalid();
    }

    public Block head() {
        return store.head().orElseThrow(() -> new IllegalStateException("Chain has no genesis block"));
    }

    public List<Block> blocks() {
        return store.blocks();
    }

    public Optional<Block> block(long index) {
        return store.get(index);
    }

    public long size() {
        return store.size();
    }

    public int difficulty() {
        return pow.difficulty();
    }

    public void addListener(BlockListener listener) {
        if (listener != null) listeners.add(listener);
    }

    public void removeListener(BlockListener listener) {
        listeners.remove(listener);
    }

    private Block mine(BlockTemplate template) {
        Optional<Block> mined = BlockMetrics.recordMining(() -> pow.mine(template, maxTries));
        if (mined.isEmpty()) {
            BlockMetrics.miningTimedOut();
            LOG.warning(() -> "Mining gave up on block " + template.index() + " after " + maxTries + " attempts");
            throw new MiningTimeoutException(template.index(), maxTries, pow.difficulty());
        }
        Block block = mined.get();
        BlockMetrics.blockMined(block.nonce() + 1);
        return block;
    }
}
