package com.libragraph.backup.core.store;

import com.libragraph.backup.archivers.store.ThreadStore;
import com.libragraph.backup.core.dao.ThreadDao;
import com.libragraph.backup.core.dao.ThreadRecord;
import com.libragraph.backup.types.ThreadUniqueId;
import com.libragraph.backup.types.model.ChatThread;
import jakarta.enterprise.context.ApplicationScoped;
import org.jdbi.v3.core.Handle;

import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class JdbiThreadStore implements ThreadStore {

    @Override
    public Optional<ChatThread> fetchThread(ThreadUniqueId uniqueId, Handle tx) {
        return tx.attach(ThreadDao.class).findByUniqueId(uniqueId.value()).map(JdbiThreadStore::toThread);
    }

    @Override
    public List<ChatThread> findAll(Handle tx) {
        return tx.attach(ThreadDao.class).findAll().stream().map(JdbiThreadStore::toThread).toList();
    }

    @Override
    public Optional<ChatThread> findByRecipientAddress(String recipientAddress, Handle tx) {
        return tx.attach(ThreadDao.class).findByRecipientAddress(recipientAddress).map(JdbiThreadStore::toThread);
    }

    @Override
    public ChatThread insert(ChatThread thread, Handle tx) {
        long id = tx.attach(ThreadDao.class).insert(thread.uniqueId().value(), thread.recipientAddress());
        return new ChatThread(id, thread.uniqueId(), thread.recipientAddress());
    }

    private static ChatThread toThread(ThreadRecord record) {
        return new ChatThread(record.id(), new ThreadUniqueId(record.uniqueId()), record.recipientAddress());
    }
}
