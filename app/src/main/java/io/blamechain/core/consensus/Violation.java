package io.blamechain.core.consensus;

/** One failed check for one block. */
public record Violation(long index, Type type, String message) {

    public enum Type {
        /** Stored hash differs from the digest recomputed over the block's fields. */
        HASH_MISMATCH,
        /** Hash lacks the required leading zeros. */
        DIFFICULTY_NOT_MET,
        /** previousHash does not equal the predecessor's hash (or the genesis sentinel). */
        BROKEN_LINK,
        /** Index is not the block's position in the chain. */
        INDEX_GAP,
        /** Fields cannot be re-hashed, or the stored bytes cannot be decoded into a block. */
        MALFORMED,
        /** Nothing stored at a position below the store's size. */
        MISSING
    }

    @Override public String toString() {
        return "Violation{index=" + index + ", " + type + ": " + message + "}";
    }
}
