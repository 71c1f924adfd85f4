package com.libragraph.backup.types.model;

/**
 * An emoji reaction attached to a message.
 */
public record MessageReaction(
        long messageRowId,
        String reactorAddress,
        String emoji,
        long sentAtTimestamp,
        long receivedAtTimestamp
) {}
