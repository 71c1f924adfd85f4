package com.libragraph.backup.archivers.store;

import com.libragraph.backup.types.model.Interaction;
import com.libragraph.backup.types.model.Message;
import org.jdbi.v3.core.Handle;

import java.util.List;

/**
 * Local interaction storage, as seen by the archivers.
 * Every call runs inside the caller's transaction.
 */
public interface InteractionStore {

    /**
     * Visits every interaction in a stable order until the visitor returns
     * {@link InteractionVisitor.VisitResult#STOP}.
     *
     * @throws InteractionStoreException if the interactions cannot be read
     */
    void enumerateAll(Handle tx, InteractionVisitor visitor);

    /** Earlier versions of the given latest revision, oldest first. */
    List<Message> findPastRevisions(long latestRowId, Handle tx);

    /**
     * Inserts an interaction and returns its row id.
     *
     * @throws InteractionStoreException if the row cannot be written
     */
    long insert(Interaction interaction, Handle tx);

    /**
     * Inserts an earlier version of the message stored at {@code latestRowId}.
     *
     * @throws InteractionStoreException if the row cannot be written
     */
    long insertPastRevision(Message revision, long latestRowId, Handle tx);
}
