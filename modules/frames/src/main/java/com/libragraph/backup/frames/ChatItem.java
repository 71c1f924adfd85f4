package com.libragraph.backup.frames;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.libragraph.backup.types.ChatItemId;

import java.util.List;
import java.util.Objects;

/**
 * Backup representation of a single message or chat event.
 *
 * <p>Expiration fields are nullable: absent means "no timer" / "timer not started".
 * Revisions are earlier versions of an edited message, oldest first, and never carry
 * revisions of their own.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatItem(
        long chatId,
        long authorId,
        long dateSent,
        DirectionalDetails directional,
        ChatItemPayload payload,
        Long expireStartDate,
        Long expiresInMs,
        boolean sealedSender,
        boolean sms,
        List<ChatItem> revisions
) {
    public ChatItem {
        if (chatId <= 0) {
            throw new IllegalArgumentException("chatId must be > 0, got: " + chatId);
        }
        if (authorId <= 0) {
            throw new IllegalArgumentException("authorId must be > 0, got: " + authorId);
        }
        Objects.requireNonNull(directional, "directional details cannot be null");
        Objects.requireNonNull(payload, "payload cannot be null");
        if (expiresInMs != null && expiresInMs <= 0) {
            throw new IllegalArgumentException("expiresInMs must be > 0 when present, got: " + expiresInMs);
        }
        revisions = revisions == null ? List.of() : List.copyOf(revisions);
        for (ChatItem revision : revisions) {
            if (!revision.revisions().isEmpty()) {
                throw new IllegalArgumentException("revisions cannot carry nested revisions");
            }
        }
    }

    @JsonIgnore
    public ChatItemId id() {
        return ChatItemId.ofTimestamp(dateSent);
    }
}
