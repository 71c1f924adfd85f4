package com.libragraph.backup.archivers.api;

/**
 * Why an enumerated interaction produced no frame and no error.
 */
public enum SkipReason {
    NO_MATCHING_ARCHIVER,
    PAST_REVISION,
    NOT_YET_IMPLEMENTED,
    EXPIRING_SOON
}
