package com.libragraph.backup.frames;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.libragraph.backup.types.InfoMessageType;

import java.util.List;
import java.util.Objects;

/**
 * The tagged body of a chat item. Exactly one variant per item.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ChatItemPayload.StandardMessage.class, name = "standard"),
        @JsonSubTypes.Type(value = ChatItemPayload.ContactMessage.class, name = "contact"),
        @JsonSubTypes.Type(value = ChatItemPayload.VoiceMessage.class, name = "voice"),
        @JsonSubTypes.Type(value = ChatItemPayload.StickerMessage.class, name = "sticker"),
        @JsonSubTypes.Type(value = ChatItemPayload.RemoteDeletedMessage.class, name = "remoteDeleted"),
        @JsonSubTypes.Type(value = ChatItemPayload.ChatUpdateMessage.class, name = "chatUpdate")
})
public sealed interface ChatItemPayload {

    /** Reactions attached to this item; empty for payloads that cannot carry any. */
    default List<Reaction> reactions() {
        return List.of();
    }

    record StandardMessage(String text, List<AttachmentPointer> attachments, List<Reaction> reactions)
            implements ChatItemPayload {
        public StandardMessage {
            attachments = attachments == null ? List.of() : List.copyOf(attachments);
            reactions = reactions == null ? List.of() : List.copyOf(reactions);
            if ((text == null || text.isEmpty()) && attachments.isEmpty()) {
                throw new IllegalArgumentException("standard message needs text or attachments");
            }
        }
    }

    record ContactMessage(ContactCard contact, List<Reaction> reactions) implements ChatItemPayload {
        public ContactMessage {
            Objects.requireNonNull(contact, "contact cannot be null");
            reactions = reactions == null ? List.of() : List.copyOf(reactions);
        }
    }

    record VoiceMessage(AttachmentPointer audio, List<Reaction> reactions) implements ChatItemPayload {
        public VoiceMessage {
            Objects.requireNonNull(audio, "audio cannot be null");
            reactions = reactions == null ? List.of() : List.copyOf(reactions);
        }
    }

    record StickerMessage(Sticker sticker, List<Reaction> reactions) implements ChatItemPayload {
        public StickerMessage {
            Objects.requireNonNull(sticker, "sticker cannot be null");
            reactions = reactions == null ? List.of() : List.copyOf(reactions);
        }
    }

    record RemoteDeletedMessage() implements ChatItemPayload {}

    record ChatUpdateMessage(InfoMessageType updateType, String detail) implements ChatItemPayload {
        public ChatUpdateMessage {
            Objects.requireNonNull(updateType, "updateType cannot be null");
        }
    }

    record Reaction(String emoji, long authorId, long sentTimestamp, long receivedTimestamp) {
        public Reaction {
            Objects.requireNonNull(emoji, "emoji cannot be null");
            if (authorId <= 0) {
                throw new IllegalArgumentException("reaction authorId must be > 0, got: " + authorId);
            }
        }
    }

    record AttachmentPointer(String contentType, String fileName, long size, String cdnKey) {}

    record Sticker(String packId, String packKey, int stickerId, String emoji) {}

    record ContactCard(String displayName, List<String> phoneNumbers) {
        public ContactCard {
            phoneNumbers = phoneNumbers == null ? List.of() : List.copyOf(phoneNumbers);
        }
    }
}
