package com.libragraph.backup.archivers.testing;

import com.libragraph.backup.archivers.store.ThreadStore;
import com.libragraph.backup.types.ThreadUniqueId;
import com.libragraph.backup.types.model.ChatThread;
import org.jdbi.v3.core.Handle;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class InMemoryThreadStore implements ThreadStore {

    private final List<ChatThread> rows = new ArrayList<>();
    private int fetches;

    public ChatThread add(String uniqueId, String recipientAddress) {
        return insert(new ChatThread(0, new ThreadUniqueId(uniqueId), recipientAddress), null);
    }

    /** Number of {@link #fetchThread} calls so far. */
    public int fetches() {
        return fetches;
    }

    @Override
    public Optional<ChatThread> fetchThread(ThreadUniqueId uniqueId, Handle tx) {
        fetches++;
        return rows.stream().filter(t -> t.uniqueId().equals(uniqueId)).findFirst();
    }

    @Override
    public List<ChatThread> findAll(Handle tx) {
        return List.copyOf(rows);
    }

    @Override
    public Optional<ChatThread> findByRecipientAddress(String recipientAddress, Handle tx) {
        return rows.stream().filter(t -> t.recipientAddress().equals(recipientAddress)).findFirst();
    }

    @Override
    public ChatThread insert(ChatThread thread, Handle tx) {
        ChatThread stored = new ChatThread(rows.size() + 1, thread.uniqueId(), thread.recipientAddress());
        rows.add(stored);
        return stored;
    }
}
