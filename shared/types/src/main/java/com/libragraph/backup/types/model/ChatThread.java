package com.libragraph.backup.types.model;

import com.libragraph.backup.types.ThreadUniqueId;

import java.util.Objects;

/**
 * A local conversation.
 *
 * @param recipientAddress the peer's address, or the group id for group threads
 */
public record ChatThread(long rowId, ThreadUniqueId uniqueId, String recipientAddress) {

    public ChatThread {
        Objects.requireNonNull(uniqueId, "uniqueId cannot be null");
        Objects.requireNonNull(recipientAddress, "recipientAddress cannot be null");
    }
}
