package io.blamechain.core.buffer;

/** The entry was refused before it reached the pending list. */
public final class EntryRejectedException extends IllegalArgumentException {
    public EntryRejectedException(String message) {
        super(message);
    }
}
