package com.libragraph.backup.archivers.api;

import com.libragraph.backup.types.ChatId;
import com.libragraph.backup.types.RecipientId;

/**
 * A backup-file identifier the restoring context could not resolve.
 */
public sealed interface RestoreId {

    record Chat(ChatId id) implements RestoreId {}

    record Recipient(RecipientId id) implements RestoreId {}

    static RestoreId chat(ChatId id) {
        return new Chat(id);
    }

    static RestoreId recipient(RecipientId id) {
        return new Recipient(id);
    }
}
