package com.libragraph.backup.archivers.store;

import org.jdbi.v3.core.Handle;

import java.util.List;

/**
 * Addresses referenced anywhere in local storage.
 */
public interface RecipientStore {

    /**
     * Every distinct address that appears as a thread peer, message author,
     * send target or reactor, sorted.
     */
    List<String> findAllAddresses(Handle tx);
}
