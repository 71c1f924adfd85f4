package com.libragraph.backup.frames;

import java.util.Objects;

public record ChatItemFrame(ChatItem chatItem) implements Frame {

    public ChatItemFrame {
        Objects.requireNonNull(chatItem, "chatItem cannot be null");
    }
}
