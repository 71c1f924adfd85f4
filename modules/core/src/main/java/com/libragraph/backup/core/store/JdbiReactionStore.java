package com.libragraph.backup.core.store;

import com.libragraph.backup.archivers.store.ReactionStore;
import com.libragraph.backup.core.dao.ReactionDao;
import com.libragraph.backup.types.model.MessageReaction;
import jakarta.enterprise.context.ApplicationScoped;
import org.jdbi.v3.core.Handle;

import java.util.List;

/**
 * One reaction per reactor and message; a later reaction replaces an earlier one.
 */
@ApplicationScoped
public class JdbiReactionStore implements ReactionStore {

    @Override
    public List<MessageReaction> findByMessage(long messageRowId, Handle tx) {
        return tx.attach(ReactionDao.class).findByMessage(messageRowId).stream()
                .map(r -> new MessageReaction(r.messageId(), r.reactorAddress(), r.emoji(), r.sentAt(), r.receivedAt()))
                .toList();
    }

    @Override
    public void insert(MessageReaction reaction, Handle tx) {
        tx.attach(ReactionDao.class).upsert(reaction.messageRowId(), reaction.reactorAddress(), reaction.emoji(),
                reaction.sentAtTimestamp(), reaction.receivedAtTimestamp());
    }
}
