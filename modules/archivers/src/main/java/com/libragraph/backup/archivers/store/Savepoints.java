package com.libragraph.backup.archivers.store;

import org.jdbi.v3.core.Handle;

/**
 * Runs a dependent insert inside a savepoint so its failure leaves the enclosing
 * item transaction usable.
 */
public final class Savepoints {

    private Savepoints() {
    }

    /**
     * Runs {@code work} inside the named savepoint, rolling back to it if the work throws.
     * The exception is rethrown.
     */
    public static void inSavepoint(Handle tx, String name, Runnable work) {
        tx.savepoint(name);
        try {
            work.run();
        } catch (RuntimeException e) {
            tx.rollbackToSavepoint(name);
            throw e;
        }
        tx.release(name);
    }
}
