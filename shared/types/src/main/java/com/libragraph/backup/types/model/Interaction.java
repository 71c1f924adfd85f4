package com.libragraph.backup.types.model;

import com.libragraph.backup.types.ChatItemId;
import com.libragraph.backup.types.ThreadUniqueId;

/**
 * One local chat message or event.
 */
public sealed interface Interaction permits Message, InfoMessage, StoryMessage {

    /** Database row id, 0 until stored. */
    long rowId();

    String uniqueId();

    ThreadUniqueId threadUniqueId();

    /** Sent timestamp in epoch millis. */
    long timestamp();

    /** Returns a copy carrying the given row id. */
    Interaction withRowId(long rowId);

    default ChatItemId chatItemId() {
        return ChatItemId.ofTimestamp(timestamp());
    }
}
