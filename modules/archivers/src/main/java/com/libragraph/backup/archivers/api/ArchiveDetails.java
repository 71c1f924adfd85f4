package com.libragraph.backup.archivers.api;

import com.libragraph.backup.frames.ChatItem;
import com.libragraph.backup.frames.ChatItemPayload;
import com.libragraph.backup.frames.DirectionalDetails;
import com.libragraph.backup.types.ChatId;
import com.libragraph.backup.types.RecipientId;

import java.util.List;
import java.util.Objects;

/**
 * What a variant extracted from one interaction. Combined with the chat id and the
 * sent timestamp it becomes a {@link ChatItem}.
 *
 * @param expireStartDate epoch millis the disappearing timer started, null if not started
 * @param expiresInMs     timer duration, null if the item does not expire
 * @param revisions       earlier versions of an edited message, oldest first
 */
public record ArchiveDetails(
        RecipientId author,
        DirectionalDetails directional,
        ChatItemPayload payload,
        Long expireStartDate,
        Long expiresInMs,
        boolean sealedSender,
        boolean sms,
        List<ChatItem> revisions
) {
    public ArchiveDetails {
        Objects.requireNonNull(author, "author cannot be null");
        Objects.requireNonNull(directional, "directional cannot be null");
        Objects.requireNonNull(payload, "payload cannot be null");
        revisions = revisions == null ? List.of() : List.copyOf(revisions);
    }

    public ChatItem toChatItem(ChatId chatId, long dateSent) {
        return new ChatItem(chatId.value(), author.value(), dateSent, directional, payload,
                expireStartDate, expiresInMs, sealedSender, sms, revisions);
    }
}
