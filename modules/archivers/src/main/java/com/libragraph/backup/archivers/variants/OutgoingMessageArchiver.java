package com.libragraph.backup.archivers.variants;

import com.libragraph.backup.archivers.api.ArchiveFrameError;
import com.libragraph.backup.archivers.api.ArchiveItemError;
import com.libragraph.backup.archivers.api.ReferencedId;
import com.libragraph.backup.archivers.api.RestoreFrameError;
import com.libragraph.backup.archivers.api.RestoreId;
import com.libragraph.backup.archivers.content.ContentsRestoreResult;
import com.libragraph.backup.archivers.content.MessageContentsArchiver;
import com.libragraph.backup.archivers.content.ReactionArchiver;
import com.libragraph.backup.archivers.context.ChatArchivingContext;
import com.libragraph.backup.archivers.context.ChatRestoringContext;
import com.libragraph.backup.archivers.store.InteractionStore;
import com.libragraph.backup.frames.ChatItem;
import com.libragraph.backup.frames.DirectionalDetails;
import com.libragraph.backup.frames.DirectionalDetails.SendStatus;
import com.libragraph.backup.types.DeliveryStatus;
import com.libragraph.backup.types.EditState;
import com.libragraph.backup.types.RecipientId;
import com.libragraph.backup.types.model.ChatThread;
import com.libragraph.backup.types.model.OutgoingMessage;
import com.libragraph.backup.util.ExpirationTimes;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Messages sent by the local account. The author is always the local recipient.
 */
@ApplicationScoped
public class OutgoingMessageArchiver extends AbstractMessageArchiver<OutgoingMessage> {

    public static final int PRIORITY = 300;

    @Inject
    public OutgoingMessageArchiver(MessageContentsArchiver contentsArchiver,
                                   ReactionArchiver reactionArchiver,
                                   InteractionStore interactionStore) {
        super(contentsArchiver, reactionArchiver, interactionStore);
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    protected Class<OutgoingMessage> messageType() {
        return OutgoingMessage.class;
    }

    @Override
    protected Optional<RecipientId> resolveAuthor(OutgoingMessage message, ChatArchivingContext context) {
        return Optional.of(context.localRecipientId());
    }

    @Override
    protected String authorAddress(OutgoingMessage message, ChatArchivingContext context) {
        return context.localAddress();
    }

    /**
     * One send status per target, sorted by recipient id. Unknown targets are dropped
     * and reported.
     */
    @Override
    protected DirectionalDetails directionalDetails(OutgoingMessage message, ChatArchivingContext context,
                                                    List<ArchiveItemError> errors) {
        List<SendStatus> statuses = new ArrayList<>();
        for (Map.Entry<String, DeliveryStatus> entry : message.recipientStates().entrySet()) {
            Optional<RecipientId> recipient = context.recipientId(entry.getKey());
            if (recipient.isEmpty()) {
                errors.add(ArchiveItemError.of(message.chatItemId(),
                        ArchiveFrameError.referencedIdMissing(ReferencedId.recipient(entry.getKey()))));
                continue;
            }
            statuses.add(new SendStatus(recipient.get().value(), entry.getValue()));
        }
        statuses.sort(Comparator.comparingLong(SendStatus::recipientId));
        return DirectionalDetails.outgoing(statuses);
    }

    @Override
    protected boolean sealedSender(OutgoingMessage message) {
        return false;
    }

    @Override
    protected boolean acceptsDirection(DirectionalDetails directional) {
        return directional instanceof DirectionalDetails.Outgoing;
    }

    @Override
    protected Optional<OutgoingMessage> rebuild(ChatItem chatItem, ChatThread thread,
                                                ContentsRestoreResult.Restored contents, EditState editState,
                                                ChatRestoringContext context, List<RestoreFrameError> errors) {
        Map<String, DeliveryStatus> recipientStates = new LinkedHashMap<>();
        if (chatItem.directional() instanceof DirectionalDetails.Outgoing outgoing) {
            for (SendStatus status : outgoing.sendStatuses()) {
                RecipientId recipientId = new RecipientId(status.recipientId());
                Optional<String> address = context.address(recipientId);
                if (address.isEmpty()) {
                    errors.add(RestoreFrameError.identifierNotFound(RestoreId.recipient(recipientId)));
                    continue;
                }
                recipientStates.put(address.get(), status.status());
            }
        }
        return Optional.of(new OutgoingMessage(
                0,
                UUID.randomUUID().toString(),
                thread.uniqueId(),
                chatItem.dateSent(),
                contents.body(),
                contents.remotelyDeleted(),
                editState,
                ExpirationTimes.startMillisOrZero(chatItem.expireStartDate()),
                ExpirationTimes.durationSecondsOrZero(chatItem.expiresInMs()),
                recipientStates));
    }
}
