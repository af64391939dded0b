package io.blamechain.core.consensus;

/** No nonce satisfied the difficulty within the configured number of attempts. */
public final class MiningTimeoutException extends RuntimeException {
    private final long index;
    private final long attempts;
    private final int difficulty;

    public MiningTimeoutException(long index, long attempts, int difficulty) {
        super("No valid nonce for block " + index + " after " + attempts + " attempts at difficulty " + difficulty);
        this.index = index;
        this.attempts = attempts;
        this.difficulty = difficulty;
    }

    public long index() { return index; }
    public long attempts() { return attempts; }
    public int difficulty() { return difficulty; }
}
