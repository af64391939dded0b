package io.blamechain.core.consensus;

import io.blamechain.core.protocol.Block;
import io.blamechain.core.protocol.BlockTemplate;
import io.blamechain.core.protocol.ProtocolLimits;

import java.util.Optional;

/**
 * Minimal Proof-of-Work:
 * - difficulty = required number of leading '0' characters in the hex hash.
 * - hash = SHA-256(template.serialize(nonce)).
 *
 * Example:
 *   difficulty = 4 -> hash must start with "0000" (16 zero bits).
 *
 * Notes:
 * - The search always starts at nonce 0, so mining the same template twice yields the same block.
 * - difficulty = 0 accepts the first hash tried.
 */
public final class ProofOfWork {

    private final int difficulty;
    private final String target;

    public ProofOfWork(int difficulty) {
        if (difficulty < 0 || difficulty > ProtocolLimits.MAX_DIFFICULTY) {
            throw new IllegalArgumentException("difficulty must be within 0.." + ProtocolLimits.MAX_DIFFICULTY + ", got " + difficulty);
        }
        this.difficulty = difficulty;
        this.target = "0".repeat(difficulty);
    }

    public int difficulty() { return difficulty; }

    /** Quick check: does this hash meet the difficulty requirement? */
    public boolean meetsTarget(String hashHex) {
        return hashHex != null && hashHex.startsWith(target);
    }

    /**
     * Search nonces 0, 1, 2, ... until the hash meets the target.
     * maxTries <= 0 means no cap. Returns Optional.empty() when the cap is exhausted.
     */
    public Optional<Block> mine(BlockTemplate template, long maxTries) {
        if (template == null) return Optional.empty();

        boolean bounded = maxTries > 0;
        long nonce = 0L;
        for (long tries = 0; !bounded || tries < maxTries; tries++, nonce++) {
            String hash = template.hashFor(nonce);
            if (meetsTarget(hash)) {
                return Optional.of(template.seal(nonce, hash));
            }
            if (nonce == Long.MAX_VALUE) {
                // nonce space exhausted
                break;
            }
        }
        return Optional.empty();
    }

    /** Unbounded search; blocks until a nonce is found. */
    public Block mine(BlockTemplate template) {
        return mine(template, 0L)
                .orElseThrow(() -> new MiningTimeoutException(template.index(), Long.MAX_VALUE, difficulty));
    }
}
