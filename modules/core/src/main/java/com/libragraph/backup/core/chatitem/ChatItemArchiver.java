package com.libragraph.backup.core.chatitem;

import com.libragraph.backup.archivers.InteractionArchiverRegistry;
import com.libragraph.backup.archivers.api.ArchiveDetails;
import com.libragraph.backup.archivers.api.ArchiveFrameError;
import com.libragraph.backup.archivers.api.ArchiveItemError;
import com.libragraph.backup.archivers.api.ArchiveMultiFrameResult;
import com.libragraph.backup.archivers.api.ArchiveTally;
import com.libragraph.backup.archivers.api.InteractionArchiveResult;
import com.libragraph.backup.archivers.api.InteractionArchiver;
import com.libragraph.backup.archivers.api.InteractionRestoreResult;
import com.libragraph.backup.archivers.api.ReferencedId;
import com.libragraph.backup.archivers.api.RestoreFrameError;
import com.libragraph.backup.archivers.api.RestoreFrameResult;
import com.libragraph.backup.archivers.api.RestoreId;
import com.libragraph.backup.archivers.api.SkipReason;
import com.libragraph.backup.archivers.context.ChatArchivingContext;
import com.libragraph.backup.archivers.context.ChatRestoringContext;
import com.libragraph.backup.archivers.store.InteractionStore;
import com.libragraph.backup.archivers.store.InteractionStoreException;
import com.libragraph.backup.archivers.store.InteractionVisitor.VisitResult;
import com.libragraph.backup.archivers.store.ThreadStore;
import com.libragraph.backup.core.config.BackupConfig;
import com.libragraph.backup.frames.ChatItem;
import com.libragraph.backup.frames.ChatItemFrame;
import com.libragraph.backup.frames.stream.FrameOutputStream;
import com.libragraph.backup.frames.stream.FrameWriteError;
import com.libragraph.backup.types.ChatId;
import com.libragraph.backup.types.ChatItemId;
import com.libragraph.backup.types.ThreadUniqueId;
import com.libragraph.backup.types.model.ChatThread;
import com.libragraph.backup.types.model.Interaction;
import com.libragraph.backup.util.DateProvider;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.JdbiException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Drives the interaction archivers over a whole archive pass, and over single chat
 * items on restore.
 *
 * <p>Transactions belong to the caller: the archive pass runs inside one read snapshot,
 * each restore inside one write transaction. Nothing here commits or rolls back.
 */
@ApplicationScoped
public class ChatItemArchiver {

    private static final Logger log = Logger.getLogger(ChatItemArchiver.class);

    @Inject
    InteractionArchiverRegistry registry;

    @Inject
    InteractionStore interactionStore;

    @Inject
    ThreadStore threadStore;

    @Inject
    DateProvider dateProvider;

    @Inject
    BackupConfig config;

    /**
     * Archives every interaction as a chat item frame.
     *
     * <p>Per-item problems are collected and returned with the result; a variant's
     * complete failure or a failing enumeration stops the pass. Frames written before
     * the stop stay written.
     */
    public ArchiveMultiFrameResult archiveInteractions(FrameOutputStream stream, ChatArchivingContext context,
                                                       Handle tx) {
        Pass pass = new Pass(stream, context, tx);
        try {
            interactionStore.enumerateAll(tx, pass::archive);
        } catch (InteractionStoreException e) {
            log.errorf(e, "Interaction enumeration failed after %d item(s)", pass.tally.snapshot().enumerated());
            return ArchiveMultiFrameResult.completeFailure(e);
        }

        if (pass.fatal != null) {
            log.errorf(pass.fatal, "Archive pass aborted at %s", pass.fatalItem);
            return ArchiveMultiFrameResult.completeFailure(pass.fatal);
        }

        ArchiveTally tally = pass.tally.snapshot();
        log.infof("Archived chat items: enumerated=%d written=%d skipped=%d failed=%d",
                tally.enumerated(), tally.framesWritten(), tally.skippedTotal(), tally.failed());
        return ArchiveMultiFrameResult.of(pass.errors, tally);
    }

    /** State of one archive pass. */
    private final class Pass {

        private final FrameOutputStream stream;
        private final ChatArchivingContext context;
        private final Handle tx;
        private final List<ArchiveItemError> errors = new ArrayList<>();
        private final ArchiveTally.Counter tally = new ArchiveTally.Counter();
        private Throwable fatal;
        private ChatItemId fatalItem;

        private Pass(FrameOutputStream stream, ChatArchivingContext context, Handle tx) {
            this.stream = stream;
            this.context = context;
            this.tx = tx;
        }

        VisitResult archive(Interaction interaction) {
            tally.enumerated();
            ChatItemId itemId = interaction.chatItemId();

            Optional<ChatId> chatId = context.chatId(interaction.threadUniqueId());
            if (chatId.isEmpty()) {
                fail(itemId, ArchiveFrameError.referencedIdMissing(ReferencedId.thread(interaction.threadUniqueId())));
                return VisitResult.CONTINUE;
            }

            Optional<InteractionArchiver> archiver = registry.findArchiver(interaction);
            if (archiver.isEmpty()) {
                if (config.strictUnsupported()) {
                    fail(itemId, ArchiveFrameError.unsupported(interaction.getClass().getSimpleName()));
                } else {
                    skip(itemId, SkipReason.NO_MATCHING_ARCHIVER);
                }
                return VisitResult.CONTINUE;
            }

            InteractionArchiveResult result;
            try {
                result = archiver.get().archive(interaction, context, tx);
            } catch (RuntimeException e) {
                result = InteractionArchiveResult.completeFailure(e);
            }

            ArchiveDetails details;
            if (result instanceof InteractionArchiveResult.Success success) {
                details = success.details();
            } else if (result instanceof InteractionArchiveResult.PartialFailure partial) {
                warn(partial.errors());
                errors.addAll(partial.errors());
                details = partial.details();
            } else if (result instanceof InteractionArchiveResult.MessageFailure failure) {
                warn(failure.errors());
                errors.addAll(failure.errors());
                tally.failed();
                return VisitResult.CONTINUE;
            } else if (result instanceof InteractionArchiveResult.IsPastRevision) {
                skip(itemId, SkipReason.PAST_REVISION);
                return VisitResult.CONTINUE;
            } else if (result instanceof InteractionArchiveResult.NotYetImplemented) {
                skip(itemId, SkipReason.NOT_YET_IMPLEMENTED);
                return VisitResult.CONTINUE;
            } else {
                fatal = ((InteractionArchiveResult.CompleteFailure) result).error();
                fatalItem = itemId;
                return VisitResult.STOP;
            }

            if (expiresBeforeUseful(details)) {
                skip(itemId, SkipReason.EXPIRING_SOON);
                return VisitResult.CONTINUE;
            }

            ChatId chat = chatId.get();
            Optional<FrameWriteError> writeError = stream.writeFrame(
                    () -> new ChatItemFrame(details.toChatItem(chat, interaction.timestamp())));
            if (writeError.isPresent()) {
                fail(itemId, ArchiveFrameError.fromWriteError(writeError.get()));
            } else {
                tally.written();
            }
            return VisitResult.CONTINUE;
        }

        private boolean expiresBeforeUseful(ArchiveDetails details) {
            if (details.expireStartDate() == null || details.expiresInMs() == null) {
                return false;
            }
            long minExpireTime = dateProvider.nowMillis() + config.minExpireTimer().toMillis();
            return details.expireStartDate() + details.expiresInMs() < minExpireTime;
        }

        private void skip(ChatItemId itemId, SkipReason reason) {
            log.debugf("Skipped %s: %s", itemId, reason);
            tally.skipped(reason);
        }

        private void fail(ChatItemId itemId, ArchiveFrameError error) {
            log.warnf("Could not archive %s: %s", itemId, error);
            errors.add(ArchiveItemError.of(itemId, error));
            tally.failed();
        }

        private void warn(List<ArchiveItemError> itemErrors) {
            for (ArchiveItemError e : itemErrors) {
                log.warnf("Archive error on %s: %s", e.objectId(), e.error());
            }
        }
    }

    /**
     * Restores one chat item into the thread its chat maps to.
     */
    public RestoreFrameResult restore(ChatItem chatItem, ChatRestoringContext context, Handle tx) {
        ChatItemId itemId = chatItem.id();

        Optional<InteractionArchiver> restorer = registry.findRestorer(chatItem);
        if (restorer.isEmpty()) {
            if (config.strictUnsupported()) {
                return RestoreFrameResult.failure(itemId, RestoreFrameError.unsupported(
                        chatItem.directional().getClass().getSimpleName() + "/"
                                + chatItem.payload().getClass().getSimpleName()));
            }
            log.debugf("Skipped %s: no matching archiver", itemId);
            return RestoreFrameResult.success();
        }

        ChatId chatId = new ChatId(chatItem.chatId());
        Optional<ThreadUniqueId> threadUniqueId = context.threadUniqueId(chatId);
        if (threadUniqueId.isEmpty()) {
            return RestoreFrameResult.failure(itemId, RestoreFrameError.identifierNotFound(RestoreId.chat(chatId)));
        }

        Optional<ChatThread> thread = threadStore.fetchThread(threadUniqueId.get(), tx);
        if (thread.isEmpty()) {
            return RestoreFrameResult.failure(itemId, RestoreFrameError.threadNotFound(threadUniqueId.get()));
        }

        InteractionRestoreResult result;
        try {
            result = restorer.get().restore(chatItem, thread.get(), context, tx);
        } catch (InteractionStoreException | JdbiException e) {
            log.warnf(e, "Storage failed restoring %s", itemId);
            return RestoreFrameResult.failure(itemId, RestoreFrameError.insertionFailed(e));
        } catch (RuntimeException e) {
            log.warnf(e, "Archiver failed restoring %s", itemId);
            return RestoreFrameResult.failure(itemId, RestoreFrameError.invalidFrame(String.valueOf(e.getMessage())));
        }
        if (result instanceof InteractionRestoreResult.Success) {
            return RestoreFrameResult.success();
        }
        if (result instanceof InteractionRestoreResult.PartialRestore partial) {
            return config.preservePartial()
                    ? RestoreFrameResult.partial(itemId, partial.errors())
                    : RestoreFrameResult.failure(itemId, partial.errors());
        }
        return RestoreFrameResult.failure(itemId, ((InteractionRestoreResult.MessageFailure) result).errors());
    }
}
