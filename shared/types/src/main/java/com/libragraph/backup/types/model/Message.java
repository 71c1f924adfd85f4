package com.libragraph.backup.types.model;

import com.libragraph.backup.types.EditState;

/**
 * A user-authored message, incoming or outgoing.
 */
public sealed interface Message extends Interaction permits IncomingMessage, OutgoingMessage {

    MessageBody body();

    boolean remotelyDeleted();

    EditState editState();

    /** Epoch millis when the disappearing timer started, 0 if it has not. */
    long expireStartedAt();

    /** Disappearing timer duration, 0 if the message does not expire. */
    int expiresInSeconds();
}
