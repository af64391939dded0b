package io.blamechain.core.node;

import io.blamechain.core.buffer.ActionBuffer;
import io.blamechain.core.buffer.EntryValidator;
import io.blamechain.core.consensus.ProofOfWork;
import io.blamechain.core.storage.ChainStore;
import io.blamechain.core.storage.InMemoryChainStore;
import io.blamechain.core.storage.RocksDBChainStore;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires storage, proof-of-work, the chain and the action buffer.
 * Constructing a node mines the genesis block (empty store) or verifies the stored chain.
 */
public final class Node implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(Node.class.getName());

    private final ChainStore store;
    private final Chain chain;
    private final ActionBuffer buffer;
    private final NodeConfig config;

    public Node(ChainStore store, NodeConfig config) {
        this.store = store;
        this.config = config;
        this.chain = new Chain(store, new ProofOfWork(config.difficulty), config.maxMiningTries);
        this.buffer = new ActionBuffer(chain, new EntryValidator(), config.flushThreshold);
        LOG.info(() -> "Node ready: " + config + ", " + chain.size() + " blocks");
    }

    /** Convenience factory for an in-memory local node. */
    public static Node inMemory(NodeConfig config) {
        return new Node(new InMemoryChainStore(), config);
    }

    /** Convenience factory for a RocksDB-backed node. */
    public static Node rocks(NodeConfig config, String dataDir) {
        RocksDBChainStore store = RocksDBChainStore.open(dataDir);
        try {
            return new Node(store, config);
        } catch (RuntimeException e) {
            store.close();
            throw e;
        }
    }

    /** Close underlying resources if any (e.g., RocksDB). */
    @Override
    public void close() {
        if (store instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Failed to close chain store", e);
            }
        }
    }

    public Chain chain() { return chain; }
    public ActionBuffer buffer() { return buffer; }
    public NodeConfig config() { return config; }
}
