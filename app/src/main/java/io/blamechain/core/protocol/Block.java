package io.blamechain.core.protocol;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;

/**
 * Finalized block: a mined template plus its nonce and hash.
 * Fields never change after construction; payload accessors hand out copies.
 */
public final class Block {
    /** previousHash of the genesis block. */
    public static final String GENESIS_PREVIOUS_HASH = "0".repeat(ProtocolLimits.HASH_HEX_LENGTH);

    private final long index;
    private final long timestamp;
    private final List<JsonNode> payload;
    private final String previousHash;
    private final long nonce;
    private final String hash;

    public Block(long index, long timestamp, List<JsonNode> payload, String previousHash, long nonce, String hash) {
        this.index = index;
        this.timestamp = timestamp;
        this.payload = BlockTemplate.copyOf(payload);
        this.previousHash = previousHash;
        this.nonce = nonce;
        this.hash = hash;
        basicValidate();
    }

    public long index() { return index; }
    public long timestamp() { return timestamp; }
    public List<JsonNode> payload() { return BlockTemplate.copyOf(payload); }
    public String previousHash() { return previousHash; }
    public long nonce() { return nonce; }
    public String hash() { return hash; }

    public boolean isGenesis() { return index == 0; }

    /** The template this block was mined from. */
    public BlockTemplate template() {
        return new BlockTemplate(index, timestamp, payload, previousHash);
    }

    /** Digest over the stored fields; equals hash() unless the block was tampered with. */
    public String recomputeHash() {
        return template().hashFor(nonce);
    }

    public void basicValidate() {
        if (nonce < 0) throw new IllegalArgumentException("nonce must be >= 0");
        if (hash == null || hash.length() != ProtocolLimits.HASH_HEX_LENGTH) {
            throw new IllegalArgumentException("hash must be " + ProtocolLimits.HASH_HEX_LENGTH + " hex chars");
        }
        if (previousHash == null) throw new IllegalArgumentException("missing previousHash");
        if (index < 0) throw new IllegalArgumentException("index must be >= 0");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Block)) return false;
        Block other = (Block) o;
        return index == other.index
                && timestamp == other.timestamp
                && nonce == other.nonce
                && previousHash.equals(other.previousHash)
                && hash.equals(other.hash)
                && payload.equals(other.payload);
    }

    @Override public int hashCode() {
        return Objects.hash(index, timestamp, payload, previousHash, nonce, hash);
    }

    @Override public String toString() {
        return "Block{index=" + index + ", entries=" + payload.size() + ", hash=" + hash.substring(0, 12) + "...}";
    }
}
