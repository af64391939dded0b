package io.blamechain.core.storage;

import io.blamechain.core.protocol.Block;
import io.blamechain.core.protocol.BlockCodec;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persistent ChainStore using RocksDB.
 *
 * Layout (column families):
 *  - "blocks" : key = index(8, big-endian), val = BlockCodec JSON bytes
 *  - "meta"   : key = "size",               val = block count(8, big-endian)
 *
 * Only mined blocks are written. Entries still waiting in the action buffer are not persisted.
 */
public final class RocksDBChainStore implements ChainStore, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(RocksDBChainStore.class.getName());
    private static final byte[] SIZE_KEY = "size".getBytes(StandardCharsets.UTF_8);

    static {
        RocksDB.loadLibrary();
    }

    private final RocksDB db;
    private final ColumnFamilyHandle cfDefault;
    private final ColumnFamilyHandle cfBlocks;
    private final ColumnFamilyHandle cfMeta;
    private final DBOptions dbOptions;
    private long size;

    private RocksDBChainStore(RocksDB db,
                              ColumnFamilyHandle cfDefault,
                              ColumnFamilyHandle cfBlocks,
                              ColumnFamilyHandle cfMeta,
                              DBOptions dbOptions) throws RocksDBException {
        this.db = db;
        this.cfDefault = cfDefault;
        this.cfBlocks = cfBlocks;
        this.cfMeta = cfMeta;
        this.dbOptions = dbOptions;
        byte[] stored = db.get(cfMeta, SIZE_KEY);
        this.size = stored == null ? 0L : bytesToLong(stored);
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksDBChainStore open(String dataDir) {
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);

        List<ColumnFamilyDescriptor> cfDescs = Arrays.asList(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                new ColumnFamilyDescriptor("blocks".getBytes(StandardCharsets.UTF_8)),
                new ColumnFamilyDescriptor("meta".getBytes(StandardCharsets.UTF_8))
        );
        List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
        try {
            RocksDB db = RocksDB.open(dbOpts, dataDir, cfDescs, cfHandles);
            RocksDBChainStore store = new RocksDBChainStore(db, cfHandles.get(0), cfHandles.get(1), cfHandles.get(2), dbOpts);
            LOG.info(() -> "Opened RocksDB chain store at " + dataDir + " (" + store.size + " blocks)");
            return store;
        } catch (RocksDBException e) {
            for (ColumnFamilyHandle handle : cfHandles) {
                handle.close();
            }
            dbOpts.close();
            throw new IllegalStateException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    // -------------- ChainStore API ----------------

    @Override
    public synchronized void append(Block block) {
        if (block == null) throw new IllegalArgumentException("block required");
        if (block.index() != size) {
            throw new IllegalArgumentException("Expected block index " + size + ", got " + block.index());
        }
        long newSize = size + 1;
        // block and size land together or not at all
        try (WriteOptions wo = new WriteOptions().setSync(true);
             WriteBatch batch = new WriteBatch()) {
            batch.put(cfBlocks, longToBytes(block.index()), BlockCodec.toBytes(block));
            batch.put(cfMeta, SIZE_KEY, longToBytes(newSize));
            db.write(wo, batch);
        } catch (RocksDBException e) {
            throw new IllegalStateException("append failed for block " + block.index(), e);
        }
        size = newSize;
    }

    @Override
    public synchronized Optional<Block> get(long index) {
        if (index < 0 || index >= size) return Optional.empty();
        try {
            byte[] body = db.get(cfBlocks, longToBytes(index));
            return body == null ? Optional.empty() : Optional.of(BlockCodec.fromBytes(body));
        } catch (RocksDBException e) {
            throw new IllegalStateException("get failed for block " + index, e);
        }
    }

    @Override
    public synchronized long size() {
        return size;
    }

    @Override
    public synchronized List<Block> blocks() {
        return ChainStore.super.blocks();
    }

    @Override
    public synchronized void close() {
        // handles first, then DB and options
        closeQuietly(cfBlocks, "blocks column family");
        closeQuietly(cfMeta, "meta column family");
        closeQuietly(cfDefault, "default column family");
        closeQuietly(db, "database");
        closeQuietly(dbOptions, "options");
    }

    // -------------- helpers ----------------

    private static void closeQuietly(AutoCloseable resource, String what) {
        if (resource == null) return;
        try {
            resource.close();
        } catch (Exception e) {
            LOG.log(Level.WARNING, "Failed to close RocksDB " + what, e);
        }
    }

    private static byte[] longToBytes(long v) {
        return ByteBuffer.allocate(8).putLong(v).array();
    }

    private static long bytesToLong(byte[] a) {
        return ByteBuffer.wrap(a).getLong();
    }
}
