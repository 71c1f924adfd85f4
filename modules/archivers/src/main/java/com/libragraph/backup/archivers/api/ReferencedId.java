package com.libragraph.backup.archivers.api;

import com.libragraph.backup.types.ThreadUniqueId;

import java.util.Objects;

/**
 * A local object an archived item points at, which the archiving context could not map.
 */
public sealed interface ReferencedId {

    record Thread(ThreadUniqueId uniqueId) implements ReferencedId {
        public Thread {
            Objects.requireNonNull(uniqueId, "uniqueId cannot be null");
        }
    }

    record Recipient(String address) implements ReferencedId {
        public Recipient {
            Objects.requireNonNull(address, "address cannot be null");
        }
    }

    static ReferencedId thread(ThreadUniqueId uniqueId) {
        return new Thread(uniqueId);
    }

    static ReferencedId recipient(String address) {
        return new Recipient(address);
    }
}
