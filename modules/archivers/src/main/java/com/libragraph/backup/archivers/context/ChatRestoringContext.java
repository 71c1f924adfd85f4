package com.libragraph.backup.archivers.context;

import com.libragraph.backup.types.ChatId;
import com.libragraph.backup.types.RecipientId;
import com.libragraph.backup.types.ThreadUniqueId;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Identifier maps for one import session: backup-file ids back to local threads and
 * addresses. Filled from recipient and chat frames, then frozen before any chat item
 * is restored.
 */
public final class ChatRestoringContext {

    private final Map<ChatId, ThreadUniqueId> threads;
    private final Map<RecipientId, String> addresses;
    private final RecipientId localRecipientId;
    private final String localAddress;

    private ChatRestoringContext(Builder builder) {
        this.threads = Map.copyOf(builder.threads);
        this.addresses = Map.copyOf(builder.addresses);
        this.localRecipientId = builder.localRecipientId;
        this.localAddress = builder.localAddress;
    }

    public static Builder builder(String localAddress) {
        return new Builder(localAddress);
    }

    public Optional<ThreadUniqueId> threadUniqueId(ChatId chatId) {
        return Optional.ofNullable(threads.get(chatId));
    }

    /** Resolves a recipient id; the local recipient resolves to the local account's address. */
    public Optional<String> address(RecipientId recipientId) {
        if (recipientId.equals(localRecipientId)) {
            return Optional.of(localAddress);
        }
        return Optional.ofNullable(addresses.get(recipientId));
    }

    public boolean isLocal(RecipientId recipientId) {
        return recipientId.equals(localRecipientId);
    }

    /** The local recipient declared by the backup, null if it declared none. */
    public RecipientId localRecipientId() {
        return localRecipientId;
    }

    public int chatCount() {
        return threads.size();
    }

    public int recipientCount() {
        return addresses.size() + (localRecipientId == null ? 0 : 1);
    }

    public static final class Builder {

        private final Map<ChatId, ThreadUniqueId> threads = new HashMap<>();
        private final Map<RecipientId, String> addresses = new HashMap<>();
        private final String localAddress;
        private RecipientId localRecipientId;

        private Builder(String localAddress) {
            this.localAddress = Objects.requireNonNull(localAddress, "localAddress cannot be null");
        }

        public Builder localRecipient(RecipientId recipientId) {
            if (localRecipientId != null && !localRecipientId.equals(recipientId)) {
                throw new IllegalStateException("Local recipient already declared as " + localRecipientId);
            }
            this.localRecipientId = Objects.requireNonNull(recipientId, "recipientId cannot be null");
            return this;
        }

        public Builder recipient(RecipientId recipientId, String address) {
            String existing = addresses.putIfAbsent(recipientId, Objects.requireNonNull(address));
            if (existing != null && !existing.equals(address)) {
                throw new IllegalStateException("Recipient " + recipientId + " declared twice");
            }
            return this;
        }

        public Builder chat(ChatId chatId, ThreadUniqueId threadUniqueId) {
            ThreadUniqueId existing = threads.putIfAbsent(chatId, Objects.requireNonNull(threadUniqueId));
            if (existing != null && !existing.equals(threadUniqueId)) {
                throw new IllegalStateException("Chat " + chatId + " declared twice");
            }
            return this;
        }

        /** Looks up a recipient declared so far; used while chat frames are being read. */
        public Optional<String> address(RecipientId recipientId) {
            if (recipientId.equals(localRecipientId)) {
                return Optional.of(localAddress);
            }
            return Optional.ofNullable(addresses.get(recipientId));
        }

        public ChatRestoringContext build() {
            return new ChatRestoringContext(this);
        }
    }
}
