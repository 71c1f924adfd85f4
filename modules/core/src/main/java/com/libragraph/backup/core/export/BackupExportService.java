package com.libragraph.backup.core.export;

import com.libragraph.backup.archivers.api.ArchiveMultiFrameResult;
import com.libragraph.backup.archivers.context.ChatArchivingContext;
import com.libragraph.backup.archivers.store.RecipientStore;
import com.libragraph.backup.archivers.store.ThreadStore;
import com.libragraph.backup.core.BackupException;
import com.libragraph.backup.core.chatitem.ChatItemArchiver;
import com.libragraph.backup.core.config.BackupConfig;
import com.libragraph.backup.frames.ChatFrame;
import com.libragraph.backup.frames.Frame;
import com.libragraph.backup.frames.RecipientFrame;
import com.libragraph.backup.frames.stream.FrameOutputStream;
import com.libragraph.backup.frames.stream.FrameWriteError;
import com.libragraph.backup.frames.stream.JsonFrameOutputStream;
import com.libragraph.backup.types.ChatId;
import com.libragraph.backup.types.RecipientId;
import com.libragraph.backup.types.model.ChatThread;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.transaction.TransactionIsolationLevel;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Writes the whole local chat history to a backup stream.
 *
 * <p>Frame order: the local recipient, remote recipients, chats, then one chat item per
 * archived interaction. Everything is read from one repeatable-read snapshot.
 */
@ApplicationScoped
public class BackupExportService {

    private static final Logger log = Logger.getLogger(BackupExportService.class);

    static final RecipientId LOCAL_RECIPIENT = new RecipientId(1);

    @Inject
    Jdbi jdbi;

    @Inject
    ThreadStore threadStore;

    @Inject
    RecipientStore recipientStore;

    @Inject
    ChatItemArchiver chatItemArchiver;

    @Inject
    BackupConfig config;

    /**
     * Exports into {@code target}, which is flushed but not closed.
     *
     * @throws BackupException if the recipient or chat frames cannot be written, or the target cannot be flushed
     */
    public BackupExportReport export(OutputStream target) {
        JsonFrameOutputStream stream = new JsonFrameOutputStream(target);
        BackupExportReport report;
        try (Handle handle = jdbi.open()) {
            handle.setReadOnly(true);
            report = handle.inTransaction(TransactionIsolationLevel.REPEATABLE_READ, tx -> writeBackup(stream, tx));
        }

        try {
            stream.flush();
        } catch (IOException e) {
            throw new BackupException("Cannot flush backup stream", e);
        }

        if (report.isComplete()) {
            log.infof("Export finished: %d recipient(s), %d chat(s), %d frame(s), %d error(s)",
                    report.recipients(), report.chats(), stream.framesWritten(), report.errors().size());
        } else {
            log.errorf("Export aborted after %d frame(s); the backup is incomplete", stream.framesWritten());
        }
        return report;
    }

    private BackupExportReport writeBackup(FrameOutputStream stream, Handle tx) {
        List<ChatThread> threads = threadStore.findAll(tx);
        ChatArchivingContext context = buildContext(threads, tx);

        write(stream, RecipientFrame.self(LOCAL_RECIPIENT.value()));
        Map<RecipientId, String> byId = new TreeMap<>((a, b) -> Long.compare(a.value(), b.value()));
        context.recipientIds().forEach((address, id) -> byId.put(id, address));
        byId.forEach((id, address) -> write(stream, RecipientFrame.of(id.value(), address)));

        for (ChatThread thread : threads) {
            ChatId chatId = context.chatId(thread.uniqueId()).orElseThrow();
            RecipientId recipientId = context.recipientId(thread.recipientAddress()).orElseThrow();
            write(stream, new ChatFrame(chatId.value(), recipientId.value()));
        }

        ArchiveMultiFrameResult result = chatItemArchiver.archiveInteractions(stream, context, tx);
        return new BackupExportReport(byId.size() + 1, threads.size(), result);
    }

    /**
     * Chat ids follow thread order from 1; recipient ids follow sorted address order from 2,
     * with 1 reserved for the local account.
     */
    ChatArchivingContext buildContext(List<ChatThread> threads, Handle tx) {
        ChatArchivingContext.Builder builder = ChatArchivingContext.builder(LOCAL_RECIPIENT, config.localAddress());

        TreeSet<String> addresses = new TreeSet<>(recipientStore.findAllAddresses(tx));
        threads.forEach(t -> addresses.add(t.recipientAddress()));
        addresses.remove(config.localAddress());
        long nextRecipientId = LOCAL_RECIPIENT.value() + 1;
        for (String address : addresses) {
            builder.recipient(address, new RecipientId(nextRecipientId++));
        }

        long nextChatId = 1;
        for (ChatThread thread : threads) {
            builder.chat(thread.uniqueId(), new ChatId(nextChatId++));
        }

        ChatArchivingContext context = builder.build();
        log.debugf("Archiving context: %d chat(s), %d remote recipient(s)",
                context.chatIds().size(), context.recipientIds().size());
        return context;
    }

    private static void write(FrameOutputStream stream, Frame frame) {
        Optional<FrameWriteError> error = stream.writeFrame(() -> frame);
        if (error.isPresent()) {
            throw new BackupException("Cannot write " + frame + ": " + error.get().message(), error.get().cause());
        }
    }
}
