package com.libragraph.backup.types;

import java.util.Objects;

/**
 * Stable local identifier of a conversation thread.
 */
public record ThreadUniqueId(String value) {

    public ThreadUniqueId {
        Objects.requireNonNull(value, "thread unique id cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("thread unique id cannot be blank");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
