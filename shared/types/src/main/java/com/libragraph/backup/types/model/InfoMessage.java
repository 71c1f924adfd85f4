package com.libragraph.backup.types.model;

import com.libragraph.backup.types.InfoMessageType;
import com.libragraph.backup.types.ThreadUniqueId;

import java.util.Objects;

/**
 * A chat event shown inline in the conversation (timer change, group update, ...).
 *
 * @param detail free-form event detail, e.g. the new timer value; may be null
 */
public record InfoMessage(
        long rowId,
        String uniqueId,
        ThreadUniqueId threadUniqueId,
        long timestamp,
        InfoMessageType type,
        String detail
) implements Interaction {

    public InfoMessage {
        Objects.requireNonNull(uniqueId, "uniqueId cannot be null");
        Objects.requireNonNull(threadUniqueId, "threadUniqueId cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
    }

    @Override
    public InfoMessage withRowId(long rowId) {
        return new InfoMessage(rowId, uniqueId, threadUniqueId, timestamp, type, detail);
    }
}
