package io.blamechain.core.buffer;

import com.fasterxml.jackson.databind.JsonNode;
import io.blamechain.core.protocol.CanonicalJson;
import io.blamechain.core.protocol.ProtocolLimits;

public class EntryValidator {
    private final int maxEntryBytes;

    public EntryValidator(int maxEntryBytes) {
        if (maxEntryBytes <= 0) {
            throw new IllegalArgumentException("maxEntryBytes must be > 0");
        }
        this.maxEntryBytes = maxEntryBytes;
    }

    public EntryValidator() {
        this(ProtocolLimits.MAX_ENTRY_BYTES);
    }

    /** @throws EntryRejectedException if the entry is missing or too large */
    public void validate(JsonNode entry) {
        if (entry == null || entry.isMissingNode()) {
            throw new EntryRejectedException("Entry required");
        }
        int size = CanonicalJson.toBytes(entry).length;
        if (size > maxEntryBytes) {
            throw new EntryRejectedException("Entry is " + size + " bytes, limit is " + maxEntryBytes);
        }
    }
}
