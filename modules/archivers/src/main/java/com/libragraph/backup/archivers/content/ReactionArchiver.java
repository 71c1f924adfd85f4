package com.libragraph.backup.archivers.content;

import com.libragraph.backup.archivers.api.ArchiveFrameError;
import com.libragraph.backup.archivers.api.ArchiveItemError;
import com.libragraph.backup.archivers.api.ReferencedId;
import com.libragraph.backup.archivers.api.RestoreFrameError;
import com.libragraph.backup.archivers.api.RestoreId;
import com.libragraph.backup.archivers.context.ChatArchivingContext;
import com.libragraph.backup.archivers.context.ChatRestoringContext;
import com.libragraph.backup.archivers.store.ReactionStore;
import com.libragraph.backup.archivers.store.Savepoints;
import com.libragraph.backup.frames.ChatItemPayload.Reaction;
import com.libragraph.backup.types.RecipientId;
import com.libragraph.backup.types.model.Message;
import com.libragraph.backup.types.model.MessageReaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Handle;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Archives and restores the emoji reactions on a message.
 *
 * <p>A reactor the context cannot resolve drops that one reaction and is reported as a
 * partial error; the message itself is unaffected.
 */
@ApplicationScoped
public class ReactionArchiver {

    private static final Logger log = Logger.getLogger(ReactionArchiver.class);

    private final ReactionStore reactionStore;

    @Inject
    public ReactionArchiver(ReactionStore reactionStore) {
        this.reactionStore = reactionStore;
    }

    public record ArchivedReactions(List<Reaction> reactions, List<ArchiveItemError> errors) {
        public ArchivedReactions {
            reactions = List.copyOf(reactions);
            errors = List.copyOf(errors);
        }
    }

    public ArchivedReactions archiveReactions(Message message, ChatArchivingContext context, Handle tx) {
        List<Reaction> reactions = new ArrayList<>();
        List<ArchiveItemError> errors = new ArrayList<>();
        for (MessageReaction reaction : reactionStore.findByMessage(message.rowId(), tx)) {
            Optional<RecipientId> author = context.recipientId(reaction.reactorAddress());
            if (author.isEmpty()) {
                errors.add(ArchiveItemError.of(message.chatItemId(),
                        ArchiveFrameError.referencedIdMissing(ReferencedId.recipient(reaction.reactorAddress()))));
                continue;
            }
            reactions.add(new Reaction(reaction.emoji(), author.get().value(),
                    reaction.sentAtTimestamp(), reaction.receivedAtTimestamp()));
        }
        if (!errors.isEmpty()) {
            log.debugf("Dropped %d reaction(s) on %s: reactor unknown", errors.size(), message.chatItemId());
        }
        return new ArchivedReactions(reactions, errors);
    }

    /**
     * Inserts the reactions of a restored message.
     *
     * @return one error per reaction that was not inserted
     */
    public List<RestoreFrameError> restoreReactions(List<Reaction> reactions, long messageRowId,
                                                    ChatRestoringContext context, Handle tx) {
        List<RestoreFrameError> errors = new ArrayList<>();
        for (Reaction reaction : reactions) {
            RecipientId authorId = new RecipientId(reaction.authorId());
            Optional<String> address = context.address(authorId);
            if (address.isEmpty()) {
                errors.add(RestoreFrameError.identifierNotFound(RestoreId.recipient(authorId)));
                continue;
            }
            MessageReaction row = new MessageReaction(messageRowId, address.get(), reaction.emoji(),
                    reaction.sentTimestamp(), reaction.receivedTimestamp());
            try {
                Savepoints.inSavepoint(tx, "reaction", () -> reactionStore.insert(row, tx));
            } catch (RuntimeException e) {
                log.warnf(e, "Reaction %s on row %d not restored", reaction.emoji(), messageRowId);
                errors.add(RestoreFrameError.insertionFailed(e));
            }
        }
        return errors;
    }
}
