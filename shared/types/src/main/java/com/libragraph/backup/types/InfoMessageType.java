package com.libragraph.backup.types;

/**
 * Kinds of chat events recorded as info messages.
 *
 * <p>{@code archivable} is false for kinds the backup format has no update
 * representation for yet.
 */
public enum InfoMessageType {
    DISAPPEARING_TIMER_CHANGED(0, true),
    GROUP_UPDATE(1, true),
    SAFETY_NUMBER_CHANGED(2, true),
    SESSION_SWITCHOVER(3, true),
    PROFILE_CHANGED(4, true),
    CALL_EVENT(5, false),
    PAYMENT_ACTIVATION(6, false);

    private final int id;
    private final boolean archivable;

    InfoMessageType(int id, boolean archivable) {
        this.id = id;
        this.archivable = archivable;
    }

    public int id() {
        return id;
    }

    public boolean archivable() {
        return archivable;
    }

    public static InfoMessageType fromId(int id) {
        for (InfoMessageType t : values()) {
            if (t.id == id) return t;
        }
        throw new IllegalArgumentException("Unknown InfoMessageType id: " + id);
    }
}
