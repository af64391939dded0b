package io.blamechain.core.protocol;

public final class ProtocolLimits {
    private ProtocolLimits(){}

    public static final int MAX_ENTRY_BYTES = 8 * 1024;      // canonical JSON size of one entry
    public static final int MAX_ENTRIES_PER_BLOCK = 10_000;
    public static final int HASH_HEX_LENGTH = 64;            // SHA-256 as hex
    public static final int MAX_DIFFICULTY = HASH_HEX_LENGTH;
}
