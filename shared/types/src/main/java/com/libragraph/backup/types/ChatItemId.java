package com.libragraph.backup.types;

/**
 * Identifies a single chat item in error reports.
 *
 * <p>Derived from the item's sent timestamp, which is what both the local
 * interaction and its backup record carry.
 */
public record ChatItemId(long value) {

    public static ChatItemId ofTimestamp(long timestamp) {
        return new ChatItemId(timestamp);
    }

    @Override
    public String toString() {
        return "chatItem:" + value;
    }
}
