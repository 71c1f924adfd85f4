package com.libragraph.backup.archivers.variants;

import com.libragraph.backup.archivers.api.ArchiveDetails;
import com.libragraph.backup.archivers.api.ArchiveFrameError;
import com.libragraph.backup.archivers.api.ArchiveItemError;
import com.libragraph.backup.archivers.api.InteractionArchiveResult;
import com.libragraph.backup.archivers.api.InteractionArchiver;
import com.libragraph.backup.archivers.api.InteractionRestoreResult;
import com.libragraph.backup.archivers.api.ReferencedId;
import com.libragraph.backup.archivers.api.RestoreFrameError;
import com.libragraph.backup.archivers.api.RestoreId;
import com.libragraph.backup.archivers.content.ContentsArchiveResult;
import com.libragraph.backup.archivers.content.ContentsRestoreResult;
import com.libragraph.backup.archivers.content.MessageContentsArchiver;
import com.libragraph.backup.archivers.content.ReactionArchiver;
import com.libragraph.backup.archivers.context.ChatArchivingContext;
import com.libragraph.backup.archivers.context.ChatRestoringContext;
import com.libragraph.backup.archivers.store.InteractionStore;
import com.libragraph.backup.archivers.store.InteractionStoreException;
import com.libragraph.backup.archivers.store.Savepoints;
import com.libragraph.backup.frames.ChatItem;
import com.libragraph.backup.frames.ChatItemPayload;
import com.libragraph.backup.frames.DirectionalDetails;
import com.libragraph.backup.types.ChatId;
import com.libragraph.backup.types.EditState;
import com.libragraph.backup.types.RecipientId;
import com.libragraph.backup.types.model.ChatThread;
import com.libragraph.backup.types.model.Interaction;
import com.libragraph.backup.types.model.Message;
import com.libragraph.backup.util.ExpirationTimes;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Handle;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Shared archive and restore flow for user-authored messages.
 *
 * <p>Subclasses supply the direction-specific parts: author resolution, directional
 * details, and how a local message is rebuilt from a chat item.
 *
 * @param <M> the message kind this variant handles
 */
public abstract class AbstractMessageArchiver<M extends Message> implements InteractionArchiver {

    private static final Logger log = Logger.getLogger(AbstractMessageArchiver.class);

    protected final MessageContentsArchiver contentsArchiver;
    protected final ReactionArchiver reactionArchiver;
    protected final InteractionStore interactionStore;

    protected AbstractMessageArchiver(MessageContentsArchiver contentsArchiver,
                                      ReactionArchiver reactionArchiver,
                                      InteractionStore interactionStore) {
        this.contentsArchiver = contentsArchiver;
        this.reactionArchiver = reactionArchiver;
        this.interactionStore = interactionStore;
    }

    protected abstract Class<M> messageType();

    /** Author of the message inside the backup, or empty if the context has no id for it. */
    protected abstract Optional<RecipientId> resolveAuthor(M message, ChatArchivingContext context);

    /** Local address of the author, reported when it cannot be resolved. */
    protected abstract String authorAddress(M message, ChatArchivingContext context);

    protected abstract DirectionalDetails directionalDetails(M message, ChatArchivingContext context,
                                                             List<ArchiveItemError> errors);

    protected abstract boolean sealedSender(M message);

    protected abstract boolean acceptsDirection(DirectionalDetails directional);

    /**
     * Rebuilds a local message from a chat item.
     *
     * @param errors receives partial restore errors
     * @return the message, or empty if the author cannot be resolved
     */
    protected abstract Optional<M> rebuild(ChatItem chatItem, ChatThread thread, ContentsRestoreResult.Restored contents,
                                           EditState editState, ChatRestoringContext context,
                                           List<RestoreFrameError> errors);

    @Override
    public boolean canArchive(Interaction interaction) {
        return messageType().isInstance(interaction);
    }

    @Override
    public boolean canRestore(ChatItem chatItem) {
        return acceptsDirection(chatItem.directional())
                && !(chatItem.payload() instanceof ChatItemPayload.ChatUpdateMessage);
    }

    @Override
    public InteractionArchiveResult archive(Interaction interaction, ChatArchivingContext context, Handle tx) {
        M message = messageType().cast(interaction);
        if (message.editState() == EditState.PAST_REVISION) {
            return InteractionArchiveResult.pastRevision();
        }

        Optional<RecipientId> author = resolveAuthor(message, context);
        if (author.isEmpty()) {
            return InteractionArchiveResult.messageFailure(ArchiveItemError.of(message.chatItemId(),
                    ArchiveFrameError.referencedIdMissing(ReferencedId.recipient(authorAddress(message, context)))));
        }

        ContentsArchiveResult contents = contentsArchiver.archiveContents(message, context, tx);
        if (contents instanceof ContentsArchiveResult.Failed failed) {
            return InteractionArchiveResult.messageFailure(failed.errors());
        }
        ContentsArchiveResult.Archived archived = (ContentsArchiveResult.Archived) contents;

        List<ArchiveItemError> errors = new ArrayList<>(archived.errors());
        DirectionalDetails directional = directionalDetails(message, context, errors);
        List<ChatItem> revisions = message.editState().isLatestRevision()
                ? archiveRevisions(message, author.get(), context, tx, errors)
                : List.of();

        ArchiveDetails details = new ArchiveDetails(
                author.get(),
                directional,
                archived.payload(),
                ExpirationTimes.startMillisOrNull(message.expireStartedAt()),
                ExpirationTimes.durationMillisOrNull(message.expiresInSeconds()),
                sealedSender(message),
                false,
                revisions);
        return InteractionArchiveResult.successOrPartial(details, errors);
    }

    private List<ChatItem> archiveRevisions(M latest, RecipientId author, ChatArchivingContext context,
                                            Handle tx, List<ArchiveItemError> errors) {
        Optional<ChatId> chatId = context.chatId(latest.threadUniqueId());
        if (chatId.isEmpty()) {
            errors.add(ArchiveItemError.of(latest.chatItemId(),
                    ArchiveFrameError.referencedIdMissing(ReferencedId.thread(latest.threadUniqueId()))));
            return List.of();
        }

        List<ChatItem> revisions = new ArrayList<>();
        for (Message past : interactionStore.findPastRevisions(latest.rowId(), tx)) {
            if (!messageType().isInstance(past)) {
                log.warnf("Revision %s of %s has a different direction, dropped", past.chatItemId(), latest.chatItemId());
                continue;
            }
            M revision = messageType().cast(past);
            ContentsArchiveResult contents = contentsArchiver.archiveRevisionContents(revision);
            if (contents instanceof ContentsArchiveResult.Failed failed) {
                errors.addAll(failed.errors());
                continue;
            }
            List<ArchiveItemError> ignored = new ArrayList<>();
            revisions.add(new ChatItem(
                    chatId.get().value(),
                    author.value(),
                    revision.timestamp(),
                    directionalDetails(revision, context, ignored),
                    ((ContentsArchiveResult.Archived) contents).payload(),
                    null,
                    null,
                    sealedSender(revision),
                    false,
                    List.of()));
        }
        return revisions;
    }

    private static RestoreFrameError authorNotFound(ChatItem chatItem) {
        return RestoreFrameError.identifierNotFound(RestoreId.recipient(new RecipientId(chatItem.authorId())));
    }

    private static RestoreFrameError timerTooLarge(ChatItem chatItem) {
        return RestoreFrameError.invalidFrame("expiration timer of " + chatItem.id() + " too large: "
                + chatItem.expiresInMs() + "ms");
    }

    @Override
    public InteractionRestoreResult restore(ChatItem chatItem, ChatThread thread, ChatRestoringContext context,
                                            Handle tx) {
        ContentsRestoreResult contents = contentsArchiver.restoreContents(chatItem.payload());
        if (contents instanceof ContentsRestoreResult.Invalid invalid) {
            return InteractionRestoreResult.messageFailure(RestoreFrameError.invalidFrame(invalid.reason()));
        }

        if (!ExpirationTimes.fitsLocalDuration(chatItem.expiresInMs())) {
            return InteractionRestoreResult.messageFailure(timerTooLarge(chatItem));
        }

        List<RestoreFrameError> errors = new ArrayList<>();
        EditState editState = chatItem.revisions().isEmpty() ? EditState.NONE : EditState.LATEST_REVISION_READ;
        Optional<M> message = rebuild(chatItem, thread, (ContentsRestoreResult.Restored) contents, editState,
                context, errors);
        if (message.isEmpty()) {
            return InteractionRestoreResult.messageFailure(authorNotFound(chatItem));
        }

        long rowId;
        try {
            rowId = interactionStore.insert(message.get(), tx);
        } catch (InteractionStoreException e) {
            return InteractionRestoreResult.messageFailure(RestoreFrameError.insertionFailed(e));
        }

        errors.addAll(reactionArchiver.restoreReactions(chatItem.payload().reactions(), rowId, context, tx));
        restoreRevisions(chatItem, thread, rowId, context, tx, errors);
        return InteractionRestoreResult.successOrPartial(errors);
    }

    private void restoreRevisions(ChatItem latest, ChatThread thread, long latestRowId, ChatRestoringContext context,
                                  Handle tx, List<RestoreFrameError> errors) {
        for (ChatItem revision : latest.revisions()) {
            ContentsRestoreResult contents = contentsArchiver.restoreContents(revision.payload());
            if (contents instanceof ContentsRestoreResult.Invalid invalid) {
                errors.add(RestoreFrameError.invalidFrame("revision " + revision.id() + ": " + invalid.reason()));
                continue;
            }
            if (!ExpirationTimes.fitsLocalDuration(revision.expiresInMs())) {
                errors.add(timerTooLarge(revision));
                continue;
            }
            Optional<M> message = rebuild(revision, thread, (ContentsRestoreResult.Restored) contents,
                    EditState.PAST_REVISION, context, errors);
            if (message.isEmpty()) {
                errors.add(authorNotFound(revision));
                continue;
            }
            try {
                Savepoints.inSavepoint(tx, "revision",
                        () -> interactionStore.insertPastRevision(message.get(), latestRowId, tx));
            } catch (InteractionStoreException e) {
                log.warnf(e, "Revision %s of %s not restored", revision.id(), latest.id());
                errors.add(RestoreFrameError.insertionFailed(e));
            }
        }
    }
}
