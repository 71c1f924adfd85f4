package com.libragraph.backup.types.model;

import com.libragraph.backup.types.EditState;
import com.libragraph.backup.types.ThreadUniqueId;

import java.util.Objects;

public record IncomingMessage(
        long rowId,
        String uniqueId,
        ThreadUniqueId threadUniqueId,
        long timestamp,
        String authorAddress,
        MessageBody body,
        boolean remotelyDeleted,
        EditState editState,
        long expireStartedAt,
        int expiresInSeconds,
        long receivedTimestamp,
        boolean sealedSender,
        boolean read
) implements Message {

    public IncomingMessage {
        Objects.requireNonNull(uniqueId, "uniqueId cannot be null");
        Objects.requireNonNull(threadUniqueId, "threadUniqueId cannot be null");
        Objects.requireNonNull(authorAddress, "authorAddress cannot be null");
        body = body == null ? MessageBody.empty() : body;
        editState = editState == null ? EditState.NONE : editState;
    }

    @Override
    public IncomingMessage withRowId(long rowId) {
        return new IncomingMessage(rowId, uniqueId, threadUniqueId, timestamp, authorAddress, body,
                remotelyDeleted, editState, expireStartedAt, expiresInSeconds, receivedTimestamp,
                sealedSender, read);
    }
}
