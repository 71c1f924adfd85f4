package com.libragraph.backup.frames;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One self-contained record of the backup stream.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(value = RecipientFrame.class, name = "recipient"),
        @JsonSubTypes.Type(value = ChatFrame.class, name = "chat"),
        @JsonSubTypes.Type(value = ChatItemFrame.class, name = "chatItem")
})
public sealed interface Frame permits RecipientFrame, ChatFrame, ChatItemFrame {
}
