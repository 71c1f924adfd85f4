package com.libragraph.backup.archivers.variants;

import com.libragraph.backup.archivers.api.ArchiveItemError;
import com.libragraph.backup.archivers.api.RestoreFrameError;
import com.libragraph.backup.archivers.content.ContentsRestoreResult;
import com.libragraph.backup.archivers.content.MessageContentsArchiver;
import com.libragraph.backup.archivers.content.ReactionArchiver;
import com.libragraph.backup.archivers.context.ChatArchivingContext;
import com.libragraph.backup.archivers.context.ChatRestoringContext;
import com.libragraph.backup.archivers.store.InteractionStore;
import com.libragraph.backup.frames.ChatItem;
import com.libragraph.backup.frames.DirectionalDetails;
import com.libragraph.backup.types.EditState;
import com.libragraph.backup.types.RecipientId;
import com.libragraph.backup.types.model.ChatThread;
import com.libragraph.backup.types.model.IncomingMessage;
import com.libragraph.backup.util.ExpirationTimes;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Messages received from another account.
 */
@ApplicationScoped
public class IncomingMessageArchiver extends AbstractMessageArchiver<IncomingMessage> {

    public static final int PRIORITY = 200;

    @Inject
    public IncomingMessageArchiver(MessageContentsArchiver contentsArchiver,
                                   ReactionArchiver reactionArchiver,
                                   InteractionStore interactionStore) {
        super(contentsArchiver, reactionArchiver, interactionStore);
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    protected Class<IncomingMessage> messageType() {
        return IncomingMessage.class;
    }

    @Override
    protected Optional<RecipientId> resolveAuthor(IncomingMessage message, ChatArchivingContext context) {
        return context.recipientId(message.authorAddress());
    }

    @Override
    protected String authorAddress(IncomingMessage message, ChatArchivingContext context) {
        return message.authorAddress();
    }

    @Override
    protected DirectionalDetails directionalDetails(IncomingMessage message, ChatArchivingContext context,
                                                    List<ArchiveItemError> errors) {
        return DirectionalDetails.incoming(message.receivedTimestamp(), message.read());
    }

    @Override
    protected boolean sealedSender(IncomingMessage message) {
        return message.sealedSender();
    }

    @Override
    protected boolean acceptsDirection(DirectionalDetails directional) {
        return directional instanceof DirectionalDetails.Incoming;
    }

    @Override
    protected Optional<IncomingMessage> rebuild(ChatItem chatItem, ChatThread thread,
                                                ContentsRestoreResult.Restored contents, EditState editState,
                                                ChatRestoringContext context, List<RestoreFrameError> errors) {
        Optional<String> author = context.address(new RecipientId(chatItem.authorId()));
        if (author.isEmpty()) {
            return Optional.empty();
        }
        long received = chatItem.dateSent();
        boolean read = false;
        if (chatItem.directional() instanceof DirectionalDetails.Incoming incoming) {
            received = incoming.dateReceived();
            read = incoming.read();
        }
        return Optional.of(new IncomingMessage(
                0,
                UUID.randomUUID().toString(),
                thread.uniqueId(),
                chatItem.dateSent(),
                author.get(),
                contents.body(),
                contents.remotelyDeleted(),
                editState,
                ExpirationTimes.startMillisOrZero(chatItem.expireStartDate()),
                ExpirationTimes.durationSecondsOrZero(chatItem.expiresInMs()),
                received,
                chatItem.sealedSender(),
                read));
    }
}
