package com.libragraph.backup.core.store;

import com.libragraph.backup.archivers.store.InteractionStore;
import com.libragraph.backup.archivers.store.InteractionStoreException;
import com.libragraph.backup.archivers.store.InteractionVisitor;
import com.libragraph.backup.core.dao.InteractionDao;
import com.libragraph.backup.core.dao.InteractionKind;
import com.libragraph.backup.core.dao.InteractionRecord;
import com.libragraph.backup.types.model.IncomingMessage;
import com.libragraph.backup.types.model.Interaction;
import com.libragraph.backup.types.model.Message;
import com.libragraph.backup.types.model.StoryMessage;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.JdbiException;
import org.jdbi.v3.core.result.ResultIterator;

import java.util.ArrayList;
import java.util.List;

@ApplicationScoped
public class JdbiInteractionStore implements InteractionStore {

    private static final Logger log = Logger.getLogger(JdbiInteractionStore.class);

    @Inject
    InteractionCodec codec;

    @Override
    public void enumerateAll(Handle tx, InteractionVisitor visitor) {
        long visited = 0;
        try (ResultIterator<InteractionRecord> rows = tx.attach(InteractionDao.class).iterateAll()) {
            while (rows.hasNext()) {
                Interaction interaction = codec.decode(rows.next());
                visited++;
                if (visitor.visit(interaction) == InteractionVisitor.VisitResult.STOP) {
                    log.debugf("Enumeration stopped by visitor after %d row(s)", visited);
                    return;
                }
            }
        } catch (JdbiException e) {
            throw new InteractionStoreException("Interaction enumeration failed after " + visited + " row(s)", e);
        }
    }

    @Override
    public List<Message> findPastRevisions(long latestRowId, Handle tx) {
        List<Message> revisions = new ArrayList<>();
        try {
            for (InteractionRecord record : tx.attach(InteractionDao.class).findPastRevisions(latestRowId)) {
                revisions.add((Message) codec.decode(record));
            }
        } catch (JdbiException e) {
            throw new InteractionStoreException("Cannot read revisions of row " + latestRowId, e);
        }
        return revisions;
    }

    @Override
    public long insert(Interaction interaction, Handle tx) {
        return insert(interaction, null, tx);
    }

    @Override
    public long insertPastRevision(Message revision, long latestRowId, Handle tx) {
        return insert(revision, latestRowId, tx);
    }

    private long insert(Interaction interaction, Long latestRowId, Handle tx) {
        String payload = codec.encode(interaction);
        short editState = interaction instanceof Message message ? (short) message.editState().id() : 0;
        try {
            return tx.attach(InteractionDao.class).insert(
                    interaction.uniqueId(),
                    interaction.threadUniqueId().value(),
                    (short) InteractionKind.of(interaction).id(),
                    interaction.timestamp(),
                    authorAddress(interaction),
                    editState,
                    latestRowId,
                    payload);
        } catch (JdbiException e) {
            throw new InteractionStoreException("Cannot insert " + interaction.chatItemId(), e);
        }
    }

    private static String authorAddress(Interaction interaction) {
        if (interaction instanceof IncomingMessage incoming) {
            return incoming.authorAddress();
        }
        if (interaction instanceof StoryMessage story) {
            return story.authorAddress();
        }
        return null;
    }
}
