package com.libragraph.backup.types;

public enum EditState {
    NONE(0, "none"),
    LATEST_REVISION_READ(1, "latest-read"),
    LATEST_REVISION_UNREAD(2, "latest-unread"),
    PAST_REVISION(3, "past-revision");

    private final int id;
    private final String label;

    EditState(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public boolean isLatestRevision() {
        return this == LATEST_REVISION_READ || this == LATEST_REVISION_UNREAD;
    }

    public static EditState fromId(int id) {
        for (EditState s : values()) {
            if (s.id == id) return s;
        }
        throw new IllegalArgumentException("Unknown EditState id: " + id);
    }
}
