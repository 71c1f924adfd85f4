package com.libragraph.backup.types;

/**
 * Identifier of a conversation inside one backup file.
 * Minted once per thread per export session; meaningless outside that file.
 */
public record ChatId(long value) {

    public ChatId {
        if (value <= 0) {
            throw new IllegalArgumentException("ChatId must be > 0, got: " + value);
        }
    }

    @Override
    public String toString() {
        return "chat:" + value;
    }
}
