package com.libragraph.backup.archivers.api;

import com.libragraph.backup.archivers.context.ChatArchivingContext;
import com.libragraph.backup.archivers.context.ChatRestoringContext;
import com.libragraph.backup.frames.ChatItem;
import com.libragraph.backup.types.model.ChatThread;
import com.libragraph.backup.types.model.Interaction;
import org.jdbi.v3.core.Handle;

/**
 * Converts one kind of interaction to and from its backup record.
 *
 * <p>Implementations are CDI beans discovered by
 * {@link com.libragraph.backup.archivers.InteractionArchiverRegistry}. The predicates
 * must be stateless, and no two variants may claim the same interaction or chat item.
 */
public interface InteractionArchiver {

    /** Dispatch order; higher is asked first. Must be unique across variants. */
    int priority();

    boolean canArchive(Interaction interaction);

    boolean canRestore(ChatItem chatItem);

    /**
     * Extracts archive details from an interaction this variant accepts.
     * Never throws for per-item problems; those come back as result values.
     */
    InteractionArchiveResult archive(Interaction interaction, ChatArchivingContext context, Handle tx);

    /**
     * Inserts the local records for a chat item this variant accepts into the given thread.
     */
    InteractionRestoreResult restore(ChatItem chatItem, ChatThread thread, ChatRestoringContext context, Handle tx);
}
