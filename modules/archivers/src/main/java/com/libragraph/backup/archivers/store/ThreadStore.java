package com.libragraph.backup.archivers.store;

import com.libragraph.backup.types.ThreadUniqueId;
import com.libragraph.backup.types.model.ChatThread;
import org.jdbi.v3.core.Handle;

import java.util.List;
import java.util.Optional;

public interface ThreadStore {

    Optional<ChatThread> fetchThread(ThreadUniqueId uniqueId, Handle tx);

    List<ChatThread> findAll(Handle tx);

    Optional<ChatThread> findByRecipientAddress(String recipientAddress, Handle tx);

    /** Inserts the thread and returns it with its row id. */
    ChatThread insert(ChatThread thread, Handle tx);
}
