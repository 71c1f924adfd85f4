package com.libragraph.backup.core.restore;

import com.libragraph.backup.archivers.api.RestoreFrameError;
import com.libragraph.backup.archivers.api.RestoreFrameResult;
import com.libragraph.backup.archivers.context.ChatRestoringContext;
import com.libragraph.backup.archivers.store.InteractionStoreException;
import com.libragraph.backup.archivers.store.ThreadStore;
import com.libragraph.backup.core.BackupException;
import com.libragraph.backup.core.chatitem.ChatItemArchiver;
import com.libragraph.backup.core.config.BackupConfig;
import com.libragraph.backup.frames.ChatFrame;
import com.libragraph.backup.frames.ChatItem;
import com.libragraph.backup.frames.ChatItemFrame;
import com.libragraph.backup.frames.Frame;
import com.libragraph.backup.frames.RecipientFrame;
import com.libragraph.backup.frames.stream.JsonFrameInputStream;
import com.libragraph.backup.types.ChatId;
import com.libragraph.backup.types.RecipientId;
import com.libragraph.backup.types.ThreadUniqueId;
import com.libragraph.backup.types.model.ChatThread;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Restores a backup stream into local storage.
 *
 * <p>Recipient and chat frames must precede the first chat item. Each chat item is
 * restored in its own transaction, which is rolled back when the item fails, so one bad
 * record never affects its siblings.
 */
@ApplicationScoped
public class BackupImportService {

    private static final Logger log = Logger.getLogger(BackupImportService.class);

    @Inject
    Jdbi jdbi;

    @Inject
    ThreadStore threadStore;

    @Inject
    ChatItemArchiver chatItemArchiver;

    @Inject
    BackupConfig config;

    /**
     * Imports from {@code source}, which is not closed.
     *
     * @throws BackupException if the stream is unreadable or its declarations are inconsistent
     */
    public BackupImportReport importBackup(InputStream source) {
        ChatRestoringContext.Builder declarations = ChatRestoringContext.builder(config.localAddress());
        ChatRestoringContext context = null;
        int recipients = 0;
        int chats = 0;
        long restored = 0;
        List<RestoreFrameResult> problems = new ArrayList<>();

        try (JsonFrameInputStream frames = new JsonFrameInputStream(source)) {
            Optional<Frame> next;
            while ((next = frames.readFrame()).isPresent()) {
                Frame frame = next.get();
                if (frame instanceof ChatItemFrame itemFrame) {
                    if (context == null) {
                        context = declarations.build();
                        log.debugf("Restoring context: %d chat(s), %d recipient(s)",
                                context.chatCount(), context.recipientCount());
                    }
                    RestoreFrameResult result = restore(itemFrame.chatItem(), context);
                    if (result instanceof RestoreFrameResult.Success) {
                        restored++;
                    } else {
                        problems.add(result);
                    }
                    continue;
                }

                if (context != null) {
                    throw new BackupException("Declaration frame after the first chat item: " + frame);
                }
                if (frame instanceof RecipientFrame recipient) {
                    declare(declarations, recipient);
                    recipients++;
                } else if (frame instanceof ChatFrame chat) {
                    declare(declarations, chat);
                    chats++;
                }
            }
        } catch (IOException e) {
            throw new BackupException("Cannot read backup stream", e);
        } catch (IllegalStateException e) {
            throw new BackupException("Inconsistent backup declarations", e);
        }

        BackupImportReport report = new BackupImportReport(recipients, chats, restored, problems);
        log.infof("Import finished: %d recipient(s), %d chat(s), %d item(s) restored, %d partial, %d failed",
                recipients, chats, restored, report.partiallyRestored(), report.failed());
        return report;
    }

    private static void declare(ChatRestoringContext.Builder declarations, RecipientFrame recipient) {
        RecipientId id = new RecipientId(recipient.id());
        if (recipient.self()) {
            declarations.localRecipient(id);
        } else {
            declarations.recipient(id, recipient.address());
        }
    }

    /** Maps the chat to the local thread with the same peer, creating the thread if there is none. */
    private void declare(ChatRestoringContext.Builder declarations, ChatFrame chat) {
        RecipientId recipientId = new RecipientId(chat.recipientId());
        String address = declarations.address(recipientId)
                .orElseThrow(() -> new BackupException(
                        "Chat " + chat.id() + " references undeclared " + recipientId));
        ChatThread thread = jdbi.inTransaction(tx -> threadStore.findByRecipientAddress(address, tx)
                .orElseGet(() -> {
                    ChatThread created = threadStore.insert(
                            new ChatThread(0, new ThreadUniqueId(UUID.randomUUID().toString()), address), tx);
                    log.debugf("Created thread %s for chat %d", created.uniqueId(), chat.id());
                    return created;
                }));
        declarations.chat(new ChatId(chat.id()), thread.uniqueId());
    }

    private RestoreFrameResult restore(ChatItem chatItem, ChatRestoringContext context) {
        try {
            return jdbi.inTransaction(tx -> {
                RestoreFrameResult result = chatItemArchiver.restore(chatItem, context, tx);
                if (result instanceof RestoreFrameResult.Failure failure) {
                    log.warnf("Could not restore %s: %s", failure.id(), failure.errors());
                    tx.rollback();
                } else if (result instanceof RestoreFrameResult.PartialRestore partial) {
                    log.warnf("Partially restored %s: %s", partial.id(), partial.errors());
                }
                return result;
            });
        } catch (JdbiException | InteractionStoreException e) {
            log.warnf(e, "Could not restore %s", chatItem.id());
            return RestoreFrameResult.failure(chatItem.id(), RestoreFrameError.insertionFailed(e));
        }
    }
}
