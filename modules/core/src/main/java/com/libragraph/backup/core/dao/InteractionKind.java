package com.libragraph.backup.core.dao;

import com.libragraph.backup.types.model.IncomingMessage;
import com.libragraph.backup.types.model.InfoMessage;
import com.libragraph.backup.types.model.Interaction;
import com.libragraph.backup.types.model.OutgoingMessage;
import com.libragraph.backup.types.model.StoryMessage;

/**
 * Discriminator stored in {@code interaction.kind}.
 */
public enum InteractionKind {
    INCOMING(0, IncomingMessage.class),
    OUTGOING(1, OutgoingMessage.class),
    INFO(2, InfoMessage.class),
    STORY(3, StoryMessage.class);

    private final int id;
    private final Class<? extends Interaction> type;

    InteractionKind(int id, Class<? extends Interaction> type) {
        this.id = id;
        this.type = type;
    }

    public int id() {
        return id;
    }

    public Class<? extends Interaction> type() {
        return type;
    }

    public static InteractionKind of(Interaction interaction) {
        for (InteractionKind k : values()) {
            if (k.type.isInstance(interaction)) return k;
        }
        throw new IllegalArgumentException("Unknown interaction type: " + interaction.getClass().getName());
    }

    public static InteractionKind fromId(int id) {
        for (InteractionKind k : values()) {
            if (k.id == id) return k;
        }
        throw new IllegalArgumentException("Unknown InteractionKind id: " + id);
    }
}
