package com.libragraph.backup.types.model;

import java.util.List;

/**
 * Payload of a message. Any part may be absent.
 *
 * @param text        body text, null if none
 * @param attachments media attachments in display order
 * @param sticker     sticker reference, null if not a sticker message
 * @param contact     shared contact card, null if none
 */
public record MessageBody(
        String text,
        List<Attachment> attachments,
        StickerRef sticker,
        ContactShare contact
) {
    public MessageBody {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public static MessageBody empty() {
        return new MessageBody(null, List.of(), null, null);
    }

    public static MessageBody ofText(String text) {
        return new MessageBody(text, List.of(), null, null);
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }

    public boolean isEmpty() {
        return !hasText() && attachments.isEmpty() && sticker == null && contact == null;
    }

    /** True when the body is exactly one voice-note attachment and nothing else. */
    public boolean isVoiceNote() {
        return !hasText() && sticker == null && contact == null
                && attachments.size() == 1 && attachments.get(0).voiceNote();
    }
}
