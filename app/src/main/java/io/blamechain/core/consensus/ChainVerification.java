package io.blamechain.core.consensus;

import java.util.List;

/** Outcome of walking the whole chain. Every violating block is listed, not just the first. */
public final class ChainVerification {
    private final long length;
    private final List<Violation> violations;

    public ChainVerification(long length, List<Violation> violations) {
        this.length = length;
        this.violations = violations != null ? List.copyOf(violations) : List.of();
    }

    public boolean isValid() { return violations.isEmpty(); }
    public long length() { return length; }
    public List<Violation> violations() { return violations; }

    /** Distinct block indices with at least one violation, in chain order. */
    public List<Long> violatingIndices() {
        return violations.stream().map(Violation::index).distinct().sorted().toList();
    }

    public void throwIfInvalid() {
        if (!isValid()) {
            throw new ChainIntegrityException(violations);
        }
    }

    @Override public String toString() {
        return isValid() ? "OK(" + length + " blocks)" : "INVALID" + violations;
    }
}
