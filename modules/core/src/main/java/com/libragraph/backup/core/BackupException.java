package com.libragraph.backup.core;

/**
 * Wraps faults of an export or import run that are not scoped to a single chat item.
 */
public class BackupException extends RuntimeException {

    public BackupException(String message, Throwable cause) {
        super(message, cause);
    }

    public BackupException(String message) {
        super(message);
    }
}
