package com.libragraph.backup.archivers.content;

import com.libragraph.backup.archivers.api.ArchiveFrameError;
import com.libragraph.backup.archivers.api.ArchiveFrameError.ContentError;
import com.libragraph.backup.archivers.api.ArchiveItemError;
import com.libragraph.backup.archivers.context.ChatArchivingContext;
import com.libragraph.backup.frames.ChatItemPayload;
import com.libragraph.backup.frames.ChatItemPayload.AttachmentPointer;
import com.libragraph.backup.frames.ChatItemPayload.ContactCard;
import com.libragraph.backup.frames.ChatItemPayload.Reaction;
import com.libragraph.backup.frames.ChatItemPayload.Sticker;
import com.libragraph.backup.types.model.Attachment;
import com.libragraph.backup.types.model.ContactShare;
import com.libragraph.backup.types.model.Message;
import com.libragraph.backup.types.model.MessageBody;
import com.libragraph.backup.types.model.StickerRef;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Handle;

import java.util.List;

/**
 * Maps message contents to the chat item payload variants and back.
 *
 * <p>Precedence on archive: remote delete, sticker, contact share, voice note, then
 * text and attachments.
 */
@ApplicationScoped
public class MessageContentsArchiver {

    private final ReactionArchiver reactionArchiver;

    @Inject
    public MessageContentsArchiver(ReactionArchiver reactionArchiver) {
        this.reactionArchiver = reactionArchiver;
    }

    /**
     * Converts the contents of a latest-revision message, reactions included.
     */
    public ContentsArchiveResult archiveContents(Message message, ChatArchivingContext context, Handle tx) {
        if (message.remotelyDeleted()) {
            return new ContentsArchiveResult.Archived(new ChatItemPayload.RemoteDeletedMessage(), List.of());
        }
        if (message.body().isEmpty()) {
            return failed(message, ContentError.EMPTY_MESSAGE);
        }
        ReactionArchiver.ArchivedReactions reactions = reactionArchiver.archiveReactions(message, context, tx);
        return new ContentsArchiveResult.Archived(toPayload(message.body(), reactions.reactions()), reactions.errors());
    }

    /**
     * Converts the contents of a past revision. Revisions carry no reactions.
     */
    public ContentsArchiveResult archiveRevisionContents(Message revision) {
        if (revision.remotelyDeleted() || revision.body().isEmpty()) {
            return failed(revision, ContentError.EMPTY_REVISION);
        }
        return new ContentsArchiveResult.Archived(toPayload(revision.body(), List.of()), List.of());
    }

    public ContentsRestoreResult restoreContents(ChatItemPayload payload) {
        if (payload instanceof ChatItemPayload.RemoteDeletedMessage) {
            return new ContentsRestoreResult.Restored(MessageBody.empty(), true);
        }
        if (payload instanceof ChatItemPayload.StandardMessage standard) {
            List<Attachment> attachments = standard.attachments().stream()
                    .map(a -> toAttachment(a, false))
                    .toList();
            return restored(new MessageBody(emptyToNull(standard.text()), attachments, null, null));
        }
        if (payload instanceof ChatItemPayload.VoiceMessage voice) {
            return restored(new MessageBody(null, List.of(toAttachment(voice.audio(), true)), null, null));
        }
        if (payload instanceof ChatItemPayload.StickerMessage sticker) {
            Sticker s = sticker.sticker();
            return restored(new MessageBody(null, List.of(),
                    new StickerRef(s.packId(), s.packKey(), s.stickerId(), s.emoji()), null));
        }
        if (payload instanceof ChatItemPayload.ContactMessage contact) {
            ContactCard c = contact.contact();
            return restored(new MessageBody(null, List.of(), null,
                    new ContactShare(c.displayName(), c.phoneNumbers())));
        }
        return new ContentsRestoreResult.Invalid(
                "payload " + payload.getClass().getSimpleName() + " is not message content");
    }

    private static ChatItemPayload toPayload(MessageBody body, List<Reaction> reactions) {
        if (body.sticker() != null) {
            StickerRef s = body.sticker();
            return new ChatItemPayload.StickerMessage(
                    new Sticker(s.packId(), s.packKey(), s.stickerId(), s.emoji()), reactions);
        }
        if (body.contact() != null) {
            ContactShare c = body.contact();
            return new ChatItemPayload.ContactMessage(new ContactCard(c.displayName(), c.phoneNumbers()), reactions);
        }
        if (body.isVoiceNote()) {
            return new ChatItemPayload.VoiceMessage(toPointer(body.attachments().get(0)), reactions);
        }
        List<AttachmentPointer> attachments = body.attachments().stream()
                .map(MessageContentsArchiver::toPointer)
                .toList();
        return new ChatItemPayload.StandardMessage(body.text(), attachments, reactions);
    }

    private static AttachmentPointer toPointer(Attachment attachment) {
        return new AttachmentPointer(attachment.contentType(), attachment.fileName(),
                attachment.size(), attachment.cdnKey());
    }

    private static Attachment toAttachment(AttachmentPointer pointer, boolean voiceNote) {
        return new Attachment(pointer.contentType(), pointer.fileName(), pointer.size(), pointer.cdnKey(), voiceNote);
    }

    private static ContentsArchiveResult failed(Message message, ContentError reason) {
        return new ContentsArchiveResult.Failed(List.of(
                ArchiveItemError.of(message.chatItemId(), ArchiveFrameError.invalidContent(reason))));
    }

    private static ContentsRestoreResult restored(MessageBody body) {
        return new ContentsRestoreResult.Restored(body, false);
    }

    private static String emptyToNull(String text) {
        return text == null || text.isEmpty() ? null : text;
    }
}
