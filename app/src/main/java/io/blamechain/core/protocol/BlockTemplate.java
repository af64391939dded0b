package io.blamechain.core.protocol;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Candidate block: everything except nonce and hash.
 *
 * Hash preimage (big-endian):
 *   int count, then per entry: int len + canonical JSON bytes
 *   long index
 *   long timestamp
 *   int len + previousHash (UTF-8)
 *   long nonce
 *
 * Everything before the nonce is fixed, so it is encoded once and reused for every mining attempt.
 */
public final class BlockTemplate {
    private final long index;
    private final long timestamp;
    private final List<JsonNode> payload;
    private final String previousHash;
    private final byte[] prefix;

    public BlockTemplate(long index, long timestamp, List<JsonNode> payload, String previousHash) {
        this.index = index;
        this.timestamp = timestamp;
        this.payload = copyOf(payload);
        this.previousHash = previousHash;
        basicValidate();
        this.prefix = encodePrefix();
    }

    public long index() { return index; }
    public long timestamp() { return timestamp; }
    public String previousHash() { return previousHash; }

    /** Deep copies; callers cannot reach the entries that get hashed. */
    public List<JsonNode> payload() { return copyOf(payload); }

    public int entryCount() { return payload.size(); }

    /** Deterministic preimage for the given nonce. */
    public byte[] serialize(long nonce) {
        ByteBuffer buf = ByteBuffer.allocate(prefix.length + 8);
        buf.put(prefix);
        buf.putLong(nonce);
        return buf.array();
    }

    public String hashFor(long nonce) {
        return Hashes.sha256Hex(serialize(nonce));
    }

    /** Seal this template with a nonce found by the miner. */
    public Block seal(long nonce, String hash) {
        return new Block(index, timestamp, payload, previousHash, nonce, hash);
    }

    private void basicValidate() {
        if (index < 0) throw new IllegalArgumentException("index must be >= 0");
        if (timestamp <= 0) throw new IllegalArgumentException("timestamp must be > 0");
        if (previousHash == null || previousHash.length() != ProtocolLimits.HASH_HEX_LENGTH) {
            throw new IllegalArgumentException("previousHash must be " + ProtocolLimits.HASH_HEX_LENGTH + " hex chars");
        }
        if (payload.size() > ProtocolLimits.MAX_ENTRIES_PER_BLOCK) {
            throw new IllegalArgumentException("too many entries: " + payload.size());
        }
    }

    private byte[] encodePrefix() {
        List<byte[]> entries = new ArrayList<>(payload.size());
        int size = 4;
        for (JsonNode entry : payload) {
            byte[] b = CanonicalJson.toBytes(entry);
            entries.add(b);
            size += 4 + b.length;
        }
        byte[] prev = previousHash.getBytes(StandardCharsets.UTF_8);
        size += 8 + 8 + 4 + prev.length;

        ByteBuffer buf = ByteBuffer.allocate(size);
        buf.putInt(entries.size());
        for (byte[] b : entries) {
            buf.putInt(b.length);
            buf.put(b);
        }
        buf.putLong(index);
        buf.putLong(timestamp);
        buf.putInt(prev.length);
        buf.put(prev);
        return buf.array();
    }

    static List<JsonNode> copyOf(List<JsonNode> entries) {
        if (entries == null || entries.isEmpty()) return List.of();
        List<JsonNode> out = new ArrayList<>(entries.size());
        for (JsonNode entry : entries) {
            if (entry == null) throw new IllegalArgumentException("payload entry must not be null");
            out.add(entry.deepCopy());
        }
        return List.copyOf(out);
    }

    @Override public String toString() {
        return "BlockTemplate{index=" + index + ", entries=" + payload.size() + "}";
    }
}
