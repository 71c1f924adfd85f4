package com.libragraph.backup.types;

/**
 * Identifier of a recipient (message author, reactor, send target) inside one backup file.
 */
public record RecipientId(long value) {

    public RecipientId {
        if (value <= 0) {
            throw new IllegalArgumentException("RecipientId must be > 0, got: " + value);
        }
    }

    @Override
    public String toString() {
        return "recipient:" + value;
    }
}
