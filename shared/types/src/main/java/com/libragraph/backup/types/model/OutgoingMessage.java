package com.libragraph.backup.types.model;

import com.libragraph.backup.types.DeliveryStatus;
import com.libragraph.backup.types.EditState;
import com.libragraph.backup.types.ThreadUniqueId;

import java.util.Map;
import java.util.Objects;

/**
 * A message sent by the local user.
 *
 * @param recipientStates delivery status per recipient address
 */
public record OutgoingMessage(
        long rowId,
        String uniqueId,
        ThreadUniqueId threadUniqueId,
        long timestamp,
        MessageBody body,
        boolean remotelyDeleted,
        EditState editState,
        long expireStartedAt,
        int expiresInSeconds,
        Map<String, DeliveryStatus> recipientStates
) implements Message {

    public OutgoingMessage {
        Objects.requireNonNull(uniqueId, "uniqueId cannot be null");
        Objects.requireNonNull(threadUniqueId, "threadUniqueId cannot be null");
        body = body == null ? MessageBody.empty() : body;
        editState = editState == null ? EditState.NONE : editState;
        recipientStates = recipientStates == null ? Map.of() : Map.copyOf(recipientStates);
    }

    @Override
    public OutgoingMessage withRowId(long rowId) {
        return new OutgoingMessage(rowId, uniqueId, threadUniqueId, timestamp, body, remotelyDeleted,
                editState, expireStartedAt, expiresInSeconds, recipientStates);
    }
}
