package com.libragraph.backup.frames;

/**
 * Declares a chat id and the recipient it talks to.
 */
public record ChatFrame(long id, long recipientId) implements Frame {

    public ChatFrame {
        if (id <= 0) {
            throw new IllegalArgumentException("chat id must be > 0, got: " + id);
        }
        if (recipientId <= 0) {
            throw new IllegalArgumentException("chat " + id + " has invalid recipient id: " + recipientId);
        }
    }
}
