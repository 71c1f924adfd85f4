package com.libragraph.backup.archivers.store;

/**
 * Thrown when the local interaction store cannot be read or written.
 */
public class InteractionStoreException extends RuntimeException {

    public InteractionStoreException(String message) {
        super(message);
    }

    public InteractionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
