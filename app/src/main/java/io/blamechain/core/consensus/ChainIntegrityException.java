package io.blamechain.core.consensus;

import java.util.List;

/**
 * Raised when stored blocks no longer form a valid chain
 * (tampering, a corrupt store, or a bug). Not recoverable.
 */
public final class ChainIntegrityException extends RuntimeException {
    private final List<Violation> violations;

    public ChainIntegrityException(List<Violation> violations) {
        super(describe(violations));
        this.violations = List.copyOf(violations);
    }

    public List<Violation> violations() { return violations; }

    private static String describe(List<Violation> violations) {
        if (violations == null || violations.isEmpty()) {
            return "Chain integrity violation";
        }
        Violation first = violations.get(0);
        String more = violations.size() > 1 ? " (+" + (violations.size() - 1) + " more)" : "";
        return "Chain integrity violation at index " + first.index() + ": " + first.message() + more;
    }
}
