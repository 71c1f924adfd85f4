package com.libragraph.backup.archivers.context;

import com.libragraph.backup.types.ChatId;
import com.libragraph.backup.types.RecipientId;
import com.libragraph.backup.types.ThreadUniqueId;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Identifier maps for one export session: local threads and addresses to the ids
 * used inside the backup file. Immutable once built.
 */
public final class ChatArchivingContext {

    private final Map<ThreadUniqueId, ChatId> chatIds;
    private final Map<String, RecipientId> recipientIds;
    private final RecipientId localRecipientId;
    private final String localAddress;

    private ChatArchivingContext(Builder builder) {
        this.chatIds = Map.copyOf(builder.chatIds);
        this.recipientIds = Map.copyOf(builder.recipientIds);
        this.localRecipientId = builder.localRecipientId;
        this.localAddress = builder.localAddress;
    }

    public static Builder builder(RecipientId localRecipientId, String localAddress) {
        return new Builder(localRecipientId, localAddress);
    }

    public Optional<ChatId> chatId(ThreadUniqueId threadUniqueId) {
        return Optional.ofNullable(chatIds.get(threadUniqueId));
    }

    /** Resolves an address; the local account's address resolves to {@link #localRecipientId()}. */
    public Optional<RecipientId> recipientId(String address) {
        if (localAddress.equals(address)) {
            return Optional.of(localRecipientId);
        }
        return Optional.ofNullable(recipientIds.get(address));
    }

    public RecipientId localRecipientId() {
        return localRecipientId;
    }

    public String localAddress() {
        return localAddress;
    }

    public Map<ThreadUniqueId, ChatId> chatIds() {
        return chatIds;
    }

    /** Remote recipients only; the local account is not included. */
    public Map<String, RecipientId> recipientIds() {
        return recipientIds;
    }

    public static final class Builder {

        private final Map<ThreadUniqueId, ChatId> chatIds = new HashMap<>();
        private final Map<String, RecipientId> recipientIds = new HashMap<>();
        private final RecipientId localRecipientId;
        private final String localAddress;

        private Builder(RecipientId localRecipientId, String localAddress) {
            this.localRecipientId = Objects.requireNonNull(localRecipientId, "localRecipientId cannot be null");
            this.localAddress = Objects.requireNonNull(localAddress, "localAddress cannot be null");
        }

        public Builder chat(ThreadUniqueId threadUniqueId, ChatId chatId) {
            ChatId existing = chatIds.putIfAbsent(threadUniqueId, chatId);
            if (existing != null && !existing.equals(chatId)) {
                throw new IllegalStateException("Thread " + threadUniqueId + " already mapped to " + existing);
            }
            return this;
        }

        public Builder recipient(String address, RecipientId recipientId) {
            if (localAddress.equals(address) || localRecipientId.equals(recipientId)) {
                throw new IllegalArgumentException("Local account cannot be registered as a remote recipient");
            }
            RecipientId existing = recipientIds.putIfAbsent(address, recipientId);
            if (existing != null && !existing.equals(recipientId)) {
                throw new IllegalStateException("Address already mapped to " + existing);
            }
            return this;
        }

        public ChatArchivingContext build() {
            return new ChatArchivingContext(this);
        }
    }
}
