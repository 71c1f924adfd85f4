package com.libragraph.backup.archivers.variants;

import com.libragraph.backup.archivers.api.ArchiveDetails;
import com.libragraph.backup.archivers.api.ArchiveFrameError;
import com.libragraph.backup.archivers.api.InteractionArchiveResult;
import com.libragraph.backup.archivers.api.InteractionRestoreResult;
import com.libragraph.backup.archivers.api.ReferencedId;
import com.libragraph.backup.archivers.api.RestoreFrameError;
import com.libragraph.backup.archivers.api.RestoreId;
import com.libragraph.backup.archivers.content.MessageContentsArchiver;
import com.libragraph.backup.archivers.content.ReactionArchiver;
import com.libragraph.backup.archivers.context.ChatRestoringContext;
import com.libragraph.backup.archivers.testing.ChatFixtures;
import com.libragraph.backup.archivers.testing.InMemoryInteractionStore;
import com.libragraph.backup.archivers.testing.InMemoryReactionStore;
import com.libragraph.backup.frames.ChatItem;
import com.libragraph.backup.frames.ChatItemPayload;
import com.libragraph.backup.frames.DirectionalDetails;
import com.libragraph.backup.types.EditState;
import com.libragraph.backup.types.RecipientId;
import com.libragraph.backup.types.model.ChatThread;
import com.libragraph.backup.types.model.IncomingMessage;
import com.libragraph.backup.types.model.MessageBody;
import com.libragraph.backup.types.model.MessageReaction;
import org.jdbi.v3.core.Handle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class IncomingMessageArchiverTest {

    private final Handle tx = mock(Handle.class);
    private InMemoryInteractionStore interactions;
    private InMemoryReactionStore reactions;
    private IncomingMessageArchiver archiver;

    @BeforeEach
    void setUp() {
        interactions = new InMemoryInteractionStore();
        reactions = new InMemoryReactionStore();
        var reactionArchiver = new ReactionArchiver(reactions);
        archiver = new IncomingMessageArchiver(new MessageContentsArchiver(reactionArchiver), reactionArchiver,
                interactions);
    }

    @Test
    void archivesAuthorDirectionAndTimer() {
        var message = new IncomingMessage(0, "m1", ChatFixtures.ALICE_THREAD, 1_000, ChatFixtures.ALICE,
                MessageBody.ofText("hello"), false, EditState.NONE, 1_500, 60, 1_010, true, false);

        InteractionArchiveResult result = archiver.archive(message, ChatFixtures.archivingContext(), tx);

        assertThat(result).isInstanceOf(InteractionArchiveResult.Success.class);
        ArchiveDetails details = ((InteractionArchiveResult.Success) result).details();
        assertThat(details.author()).isEqualTo(ChatFixtures.ALICE_ID);
        assertThat(details.directional()).isEqualTo(DirectionalDetails.incoming(1_010, false));
        assertThat(details.expireStartDate()).isEqualTo(1_500L);
        assertThat(details.expiresInMs()).isEqualTo(60_000L);
        assertThat(details.sealedSender()).isTrue();
        assertThat(details.revisions()).isEmpty();
    }

    @Test
    void unknownAuthorIsMessageFailure() {
        var message = new IncomingMessage(0, "m1", ChatFixtures.ALICE_THREAD, 1_000, ChatFixtures.BOB,
                MessageBody.ofText("hello"), false, EditState.NONE, 0, 0, 1_010, false, true);

        InteractionArchiveResult result = archiver.archive(message, ChatFixtures.archivingContext(), tx);

        assertThat(result).isInstanceOf(InteractionArchiveResult.MessageFailure.class);
        assertThat(((InteractionArchiveResult.MessageFailure) result).errors())
                .singleElement()
                .satisfies(e -> assertThat(e.error()).isEqualTo(
                        ArchiveFrameError.referencedIdMissing(ReferencedId.recipient(ChatFixtures.BOB))));
    }

    @Test
    void unknownReactorIsPartialFailure() {
        var message = interactions.add(ChatFixtures.incoming(1_000, "hi"));
        reactions.add(new MessageReaction(message.rowId(), ChatFixtures.BOB, "🔥", 1_100, 1_100));

        InteractionArchiveResult result = archiver.archive(message, ChatFixtures.archivingContext(), tx);

        assertThat(result).isInstanceOf(InteractionArchiveResult.PartialFailure.class);
        var partial = (InteractionArchiveResult.PartialFailure) result;
        assertThat(partial.details().payload().reactions()).isEmpty();
        assertThat(partial.errors()).hasSize(1);
    }

    @Test
    void pastRevisionIsSkipped() {
        var message = new IncomingMessage(0, "m1", ChatFixtures.ALICE_THREAD, 1_000, ChatFixtures.ALICE,
                MessageBody.ofText("old"), false, EditState.PAST_REVISION, 0, 0, 1_010, false, true);

        assertThat(archiver.archive(message, ChatFixtures.archivingContext(), tx))
                .isInstanceOf(InteractionArchiveResult.IsPastRevision.class);
    }

    @Test
    void latestRevisionCarriesPastRevisions() {
        var latest = interactions.add(new IncomingMessage(0, "m1", ChatFixtures.ALICE_THREAD, 3_000,
                ChatFixtures.ALICE, MessageBody.ofText("v3"), false, EditState.LATEST_REVISION_READ,
                0, 0, 3_010, false, true));
        interactions.addPastRevision(new IncomingMessage(0, "m1-v1", ChatFixtures.ALICE_THREAD, 1_000,
                ChatFixtures.ALICE, MessageBody.ofText("v1"), false, EditState.PAST_REVISION,
                0, 0, 1_010, false, true), latest.rowId());
        interactions.addPastRevision(new IncomingMessage(0, "m1-v2", ChatFixtures.ALICE_THREAD, 2_000,
                ChatFixtures.ALICE, MessageBody.ofText("v2"), false, EditState.PAST_REVISION,
                0, 0, 2_010, false, true), latest.rowId());

        InteractionArchiveResult result = archiver.archive(latest, ChatFixtures.archivingContext(), tx);

        assertThat(result).isInstanceOf(InteractionArchiveResult.Success.class);
        List<ChatItem> revisions = ((InteractionArchiveResult.Success) result).details().revisions();
        assertThat(revisions).extracting(ChatItem::dateSent).containsExactly(1_000L, 2_000L);
        assertThat(revisions).allSatisfy(r -> {
            assertThat(r.chatId()).isEqualTo(ChatFixtures.ALICE_CHAT.value());
            assertThat(r.revisions()).isEmpty();
        });
    }

    @Test
    void restoreInsertsMessageReactionsAndRevisions() {
        var thread = new ChatThread(1, ChatFixtures.ALICE_THREAD, ChatFixtures.ALICE);
        var context = restoringContext();
        var revision = new ChatItem(1, 2, 1_000, DirectionalDetails.incoming(1_010, true),
                new ChatItemPayload.StandardMessage("v1", List.of(), List.of()), null, null, false, false, List.of());
        var item = new ChatItem(1, 2, 2_000, DirectionalDetails.incoming(2_010, true),
                new ChatItemPayload.StandardMessage("v2", List.of(),
                        List.of(new ChatItemPayload.Reaction("👍", 1, 2_100, 2_100))),
                2_000L, 3_600_000L, true, false, List.of(revision));

        InteractionRestoreResult result = archiver.restore(item, thread, context, tx);

        assertThat(result).isInstanceOf(InteractionRestoreResult.Success.class);
        assertThat(interactions.all()).hasSize(2);
        var restored = (IncomingMessage) interactions.all().get(0);
        assertThat(restored.authorAddress()).isEqualTo(ChatFixtures.ALICE);
        assertThat(restored.body().text()).isEqualTo("v2");
        assertThat(restored.editState()).isEqualTo(EditState.LATEST_REVISION_READ);
        assertThat(restored.expiresInSeconds()).isEqualTo(3_600);
        assertThat(restored.receivedTimestamp()).isEqualTo(2_010);
        assertThat(interactions.revisionsOf(restored.rowId()))
                .singleElement()
                .satisfies(r -> assertThat(r.editState()).isEqualTo(EditState.PAST_REVISION));
        assertThat(reactions.all()).singleElement()
                .satisfies(r -> assertThat(r.reactorAddress()).isEqualTo(ChatFixtures.LOCAL));
    }

    @Test
    void restoreWithUnknownAuthorInsertsNothing() {
        var thread = new ChatThread(1, ChatFixtures.ALICE_THREAD, ChatFixtures.ALICE);
        var item = new ChatItem(1, 9, 2_000, DirectionalDetails.incoming(2_010, true),
                new ChatItemPayload.StandardMessage("hi", List.of(), List.of()), null, null, false, false, List.of());

        InteractionRestoreResult result = archiver.restore(item, thread, restoringContext(), tx);

        assertThat(result).isEqualTo(new InteractionRestoreResult.MessageFailure(List.of(
                RestoreFrameError.identifierNotFound(RestoreId.recipient(new RecipientId(9))))));
        assertThat(interactions.all()).isEmpty();
    }

    @Test
    void insertFailureIsMessageFailure() {
        interactions.failInserts();
        var thread = new ChatThread(1, ChatFixtures.ALICE_THREAD, ChatFixtures.ALICE);
        var item = new ChatItem(1, 2, 2_000, DirectionalDetails.incoming(2_010, true),
                new ChatItemPayload.StandardMessage("hi", List.of(), List.of()), null, null, false, false, List.of());

        InteractionRestoreResult result = archiver.restore(item, thread, restoringContext(), tx);

        assertThat(result).isInstanceOf(InteractionRestoreResult.MessageFailure.class);
        assertThat(((InteractionRestoreResult.MessageFailure) result).errors())
                .singleElement()
                .isInstanceOf(RestoreFrameError.DatabaseInsertionFailed.class);
    }

    // --- expiration timers

    @Test
    void subSecondTimerSurvivesRestore() {
        var thread = new ChatThread(1, ChatFixtures.ALICE_THREAD, ChatFixtures.ALICE);
        var item = new ChatItem(1, 2, 2_000, DirectionalDetails.incoming(2_010, true),
                new ChatItemPayload.StandardMessage("hi", List.of(), List.of()), 2_000L, 1_500L, false, false, List.of());

        InteractionRestoreResult result = archiver.restore(item, thread, restoringContext(), tx);

        assertThat(result).isInstanceOf(InteractionRestoreResult.Success.class);
        assertThat(interactions.all()).singleElement()
                .isInstanceOfSatisfying(IncomingMessage.class, m -> assertThat(m.expiresInSeconds()).isEqualTo(2));
    }

    @Test
    void oversizedTimerIsMessageFailureNotException() {
        var thread = new ChatThread(1, ChatFixtures.ALICE_THREAD, ChatFixtures.ALICE);
        var item = new ChatItem(1, 2, 2_000, DirectionalDetails.incoming(2_010, true),
                new ChatItemPayload.StandardMessage("hi", List.of(), List.of()), 2_000L, Long.MAX_VALUE / 2,
                false, false, List.of());

        InteractionRestoreResult result = archiver.restore(item, thread, restoringContext(), tx);

        assertThat(result).isInstanceOfSatisfying(InteractionRestoreResult.MessageFailure.class, f ->
                assertThat(f.errors()).singleElement()
                        .isInstanceOfSatisfying(RestoreFrameError.InvalidFrame.class,
                                e -> assertThat(e.reason()).contains("too large")));
        assertThat(interactions.all()).isEmpty();
    }

    @Test
    void oversizedRevisionTimerDropsOnlyThatRevision() {
        var thread = new ChatThread(1, ChatFixtures.ALICE_THREAD, ChatFixtures.ALICE);
        var revision = new ChatItem(1, 2, 1_000, DirectionalDetails.incoming(1_010, true),
                new ChatItemPayload.StandardMessage("v1", List.of(), List.of()), 1_000L, Long.MAX_VALUE,
                false, false, List.of());
        var item = new ChatItem(1, 2, 2_000, DirectionalDetails.incoming(2_010, true),
                new ChatItemPayload.StandardMessage("v2", List.of(), List.of()), null, null, false, false,
                List.of(revision));

        InteractionRestoreResult result = archiver.restore(item, thread, restoringContext(), tx);

        assertThat(result).isInstanceOfSatisfying(InteractionRestoreResult.PartialRestore.class, p ->
                assertThat(p.errors()).singleElement().isInstanceOf(RestoreFrameError.InvalidFrame.class));
        assertThat(interactions.all()).hasSize(1);
    }

    // --- dependent inserts

    @Test
    void failedRevisionInsertRollsBackToItsSavepoint() {
        interactions.failRevisionInserts();
        var thread = new ChatThread(1, ChatFixtures.ALICE_THREAD, ChatFixtures.ALICE);
        var revision = new ChatItem(1, 2, 1_000, DirectionalDetails.incoming(1_010, true),
                new ChatItemPayload.StandardMessage("v1", List.of(), List.of()), null, null, false, false, List.of());
        var item = new ChatItem(1, 2, 2_000, DirectionalDetails.incoming(2_010, true),
                new ChatItemPayload.StandardMessage("v2", List.of(),
                        List.of(new ChatItemPayload.Reaction("👍", 1, 2_100, 2_100))),
                null, null, false, false, List.of(revision));

        InteractionRestoreResult result = archiver.restore(item, thread, restoringContext(), tx);

        assertThat(result).isInstanceOfSatisfying(InteractionRestoreResult.PartialRestore.class, p ->
                assertThat(p.errors()).singleElement().isInstanceOf(RestoreFrameError.DatabaseInsertionFailed.class));
        assertThat(interactions.all()).hasSize(1);
        assertThat(reactions.all()).hasSize(1);
        verify(tx).release("reaction");
        verify(tx).savepoint("revision");
        verify(tx).rollbackToSavepoint("revision");
        verify(tx, never()).release("revision");
        verify(tx, never()).rollback();
    }

    private static ChatRestoringContext restoringContext() {
        return ChatRestoringContext.builder(ChatFixtures.LOCAL)
                .localRecipient(new RecipientId(1))
                .recipient(new RecipientId(2), ChatFixtures.ALICE)
                .chat(ChatFixtures.ALICE_CHAT, ChatFixtures.ALICE_THREAD)
                .build();
    }
}
