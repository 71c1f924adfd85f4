package com.libragraph.backup.frames;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Declares a recipient id used by later frames.
 *
 * @param address the recipient's address; null for the local account
 * @param self    true for the local account
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecipientFrame(long id, String address, boolean self) implements Frame {

    public RecipientFrame {
        if (id <= 0) {
            throw new IllegalArgumentException("recipient id must be > 0, got: " + id);
        }
        if (!self && (address == null || address.isBlank())) {
            throw new IllegalArgumentException("non-self recipient " + id + " needs an address");
        }
    }

    public static RecipientFrame self(long id) {
        return new RecipientFrame(id, null, true);
    }

    public static RecipientFrame of(long id, String address) {
        return new RecipientFrame(id, address, false);
    }
}
