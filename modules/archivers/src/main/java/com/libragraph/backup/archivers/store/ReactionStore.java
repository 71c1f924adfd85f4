package com.libragraph.backup.archivers.store;

import com.libragraph.backup.types.model.MessageReaction;
import org.jdbi.v3.core.Handle;

import java.util.List;

public interface ReactionStore {

    /** Reactions on a message, in the order they were received. */
    List<MessageReaction> findByMessage(long messageRowId, Handle tx);

    void insert(MessageReaction reaction, Handle tx);
}
