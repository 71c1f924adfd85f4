package com.libragraph.backup.types.model;

import java.util.List;

public record ContactShare(
        String displayName,
        List<String> phoneNumbers
) {
    public ContactShare {
        phoneNumbers = phoneNumbers == null ? List.of() : List.copyOf(phoneNumbers);
    }
}
