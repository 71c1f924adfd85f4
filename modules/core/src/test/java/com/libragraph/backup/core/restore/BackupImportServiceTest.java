package com.libragraph.backup.core.restore;

import com.libragraph.backup.archivers.InteractionArchiverRegistry;
import com.libragraph.backup.archivers.api.InteractionRestoreResult;
import com.libragraph.backup.archivers.api.RestoreFrameError;
import com.libragraph.backup.archivers.api.RestoreFrameResult;
import com.libragraph.backup.archivers.context.ChatRestoringContext;
import com.libragraph.backup.archivers.store.InteractionStoreException;
import com.libragraph.backup.archivers.testing.ChatFixtures;
import com.libragraph.backup.archivers.testing.InMemoryInteractionStore;
import com.libragraph.backup.archivers.testing.InMemoryThreadStore;
import com.libragraph.backup.core.BackupException;
import com.libragraph.backup.core.chatitem.ChatItemArchivers;
import com.libragraph.backup.core.config.BackupConfig;
import com.libragraph.backup.core.testing.MockJdbi;
import com.libragraph.backup.core.testing.ScriptedArchiver;
import com.libragraph.backup.frames.ChatFrame;
import com.libragraph.backup.frames.ChatItem;
import com.libragraph.backup.frames.ChatItemFrame;
import com.libragraph.backup.frames.ChatItemPayload;
import com.libragraph.backup.frames.DirectionalDetails;
import com.libragraph.backup.frames.Frame;
import com.libragraph.backup.frames.RecipientFrame;
import com.libragraph.backup.frames.stream.JsonFrameOutputStream;
import com.libragraph.backup.types.model.ChatThread;
import com.libragraph.backup.util.DateProvider;
import org.jdbi.v3.core.ConnectionException;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.HandleCallback;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.stubbing.Answer;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class BackupImportServiceTest {

    private final Handle handle = mock(Handle.class);
    private InMemoryThreadStore threads;

    @BeforeEach
    void setUp() {
        threads = new InMemoryThreadStore();
    }

    @Test
    void chatMapsToExistingThreadOfSamePeer() throws Exception {
        ChatThread existing = threads.add("thread-local-alice", ChatFixtures.ALICE);
        var variant = ScriptedArchiver.restoring(c -> true, InteractionRestoreResult.success());

        BackupImportReport report = service(variant).importBackup(backup(
                RecipientFrame.self(1),
                RecipientFrame.of(2, ChatFixtures.ALICE),
                new ChatFrame(1, 2),
                item(1, 1_000)));

        assertThat(report.recipients()).isEqualTo(2);
        assertThat(report.chats()).isEqualTo(1);
        assertThat(report.restored()).isEqualTo(1);
        assertThat(report.problems()).isEmpty();
        assertThat(threads.findAll(handle)).containsExactly(existing);
        assertThat(variant.lastThread()).isEqualTo(existing);
    }

    @Test
    void chatWithUnknownPeerCreatesThread() throws Exception {
        var variant = ScriptedArchiver.restoring(c -> true, InteractionRestoreResult.success());

        service(variant).importBackup(backup(
                RecipientFrame.self(1),
                RecipientFrame.of(2, ChatFixtures.BOB),
                new ChatFrame(1, 2)));

        assertThat(threads.findAll(handle)).singleElement()
                .satisfies(t -> assertThat(t.recipientAddress()).isEqualTo(ChatFixtures.BOB));
    }

    @Test
    void failedItemIsRolledBackAndSiblingsContinue() throws Exception {
        threads.add("thread-local-alice", ChatFixtures.ALICE);
        var invalid = RestoreFrameError.invalidFrame("broken");
        var variant = new ScriptedArchiver(1, i -> false, i -> {
            throw new AssertionError("archive not expected");
        }) {
            @Override
            public InteractionRestoreResult restore(ChatItem chatItem, ChatThread thread,
                                                    ChatRestoringContext context,
                                                    Handle tx) {
                return chatItem.dateSent() == 1_000
                        ? InteractionRestoreResult.messageFailure(invalid)
                        : InteractionRestoreResult.success();
            }

            @Override
            public boolean canRestore(ChatItem chatItem) {
                return true;
            }
        };

        BackupImportReport report = service(variant).importBackup(backup(
                RecipientFrame.self(1),
                RecipientFrame.of(2, ChatFixtures.ALICE),
                new ChatFrame(1, 2),
                item(1, 1_000),
                item(1, 2_000)));

        assertThat(report.restored()).isEqualTo(1);
        assertThat(report.failed()).isEqualTo(1);
        assertThat(report.problems()).containsExactly(RestoreFrameResult.failure(item(1, 1_000).chatItem().id(), invalid));
        verify(handle, times(1)).rollback();
    }

    // --- faults

    @Test
    void storeExceptionBecomesInsertionFailure() throws Exception {
        threads.add("thread-local-alice", ChatFixtures.ALICE);
        var variant = ScriptedArchiver.failingRestore(new InteractionStoreException("constraint violated"));

        BackupImportReport report = service(variant).importBackup(backup(
                RecipientFrame.self(1),
                RecipientFrame.of(2, ChatFixtures.ALICE),
                new ChatFrame(1, 2),
                item(1, 1_000)));

        assertThat(report.problems()).singleElement()
                .isInstanceOfSatisfying(RestoreFrameResult.Failure.class, f -> assertThat(f.errors())
                        .singleElement()
                        .isInstanceOf(RestoreFrameError.DatabaseInsertionFailed.class));
        verify(handle).rollback();
    }

    @Test
    void nonStorageFaultIsNotReportedAsInsertionFailure() throws Exception {
        threads.add("thread-local-alice", ChatFixtures.ALICE);
        var variant = ScriptedArchiver.failingRestore(new IllegalArgumentException("timer out of range"));

        BackupImportReport report = service(variant).importBackup(backup(
                RecipientFrame.self(1),
                RecipientFrame.of(2, ChatFixtures.ALICE),
                new ChatFrame(1, 2),
                item(1, 1_000)));

        assertThat(report.problems()).containsExactly(RestoreFrameResult.failure(
                item(1, 1_000).chatItem().id(), RestoreFrameError.invalidFrame("timer out of range")));
    }

    @Test
    void transactionFaultFailsOnlyThatItem() throws Exception {
        threads.add("thread-local-alice", ChatFixtures.ALICE);
        var variant = ScriptedArchiver.restoring(c -> true, InteractionRestoreResult.success());
        Jdbi jdbi = MockJdbi.over(handle);
        Answer<Object> inHandle = inv -> inv.<HandleCallback<Object, Exception>>getArgument(0).withHandle(handle);
        doAnswer(inHandle)
                .doThrow(new ConnectionException(new SQLException("connection reset")))
                .doAnswer(inHandle)
                .when(jdbi).inTransaction(any());

        BackupImportReport report = service(variant, jdbi).importBackup(backup(
                RecipientFrame.self(1),
                RecipientFrame.of(2, ChatFixtures.ALICE),
                new ChatFrame(1, 2),
                item(1, 1_000),
                item(1, 2_000)));

        assertThat(report.restored()).isEqualTo(1);
        assertThat(report.problems()).singleElement()
                .isInstanceOfSatisfying(RestoreFrameResult.Failure.class, f -> {
                    assertThat(f.id()).isEqualTo(item(1, 1_000).chatItem().id());
                    assertThat(f.errors()).singleElement()
                            .isInstanceOf(RestoreFrameError.DatabaseInsertionFailed.class);
                });
    }

    @Test
    void declarationAfterFirstItemIsRejected() throws Exception {
        var variant = ScriptedArchiver.restoring(c -> false, InteractionRestoreResult.success());
        InputStream source = backup(
                RecipientFrame.self(1),
                item(1, 1_000),
                RecipientFrame.of(2, ChatFixtures.ALICE));

        assertThatThrownBy(() -> service(variant).importBackup(source))
                .isInstanceOf(BackupException.class)
                .hasMessageContaining("after the first chat item");
    }

    @Test
    void chatWithUndeclaredRecipientIsRejected() throws Exception {
        var variant = ScriptedArchiver.restoring(c -> true, InteractionRestoreResult.success());
        InputStream source = backup(RecipientFrame.self(1), new ChatFrame(1, 5));

        assertThatThrownBy(() -> service(variant).importBackup(source))
                .isInstanceOf(BackupException.class)
                .hasMessageContaining("undeclared");
    }

    @Test
    void conflictingDeclarationsAreRejected() throws Exception {
        var variant = ScriptedArchiver.restoring(c -> true, InteractionRestoreResult.success());
        InputStream source = backup(
                RecipientFrame.of(2, ChatFixtures.ALICE),
                RecipientFrame.of(2, ChatFixtures.BOB));

        assertThatThrownBy(() -> service(variant).importBackup(source))
                .isInstanceOf(BackupException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void unreadableStreamIsRejected() throws Exception {
        var variant = ScriptedArchiver.restoring(c -> true, InteractionRestoreResult.success());
        InputStream source = new ByteArrayInputStream("{\"frame\": nope\n".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> service(variant).importBackup(source))
                .isInstanceOf(BackupException.class);
    }

    private BackupImportService service(ScriptedArchiver variant) throws Exception {
        return service(variant, MockJdbi.over(handle));
    }

    private BackupImportService service(ScriptedArchiver variant, Jdbi jdbi) {
        BackupConfig config = BackupConfig.of(Duration.ofHours(24), false, false, ChatFixtures.LOCAL);
        var chatItemArchiver = ChatItemArchivers.create(InteractionArchiverRegistry.of(variant),
                new InMemoryInteractionStore(), threads, DateProvider.system(), config);
        return BackupImportServices.create(jdbi, threads, chatItemArchiver, config);
    }

    private static ChatItemFrame item(long chatId, long dateSent) {
        return new ChatItemFrame(new ChatItem(chatId, 2, dateSent, DirectionalDetails.incoming(dateSent + 1, true),
                new ChatItemPayload.StandardMessage("m" + dateSent, List.of(), List.of()),
                null, null, false, false, List.of()));
    }

    private static InputStream backup(Frame... frames) throws IOException {
        var out = new ByteArrayOutputStream();
        var stream = new JsonFrameOutputStream(out);
        for (Frame frame : frames) {
            assertThat(stream.writeFrame(() -> frame)).isEmpty();
        }
        stream.flush();
        return new ByteArrayInputStream(out.toByteArray());
    }
}
