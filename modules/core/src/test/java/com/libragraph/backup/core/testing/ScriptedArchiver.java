package com.libragraph.backup.core.testing;

import com.libragraph.backup.archivers.api.InteractionArchiveResult;
import com.libragraph.backup.archivers.api.InteractionArchiver;
import com.libragraph.backup.archivers.api.InteractionRestoreResult;
import com.libragraph.backup.archivers.context.ChatArchivingContext;
import com.libragraph.backup.archivers.context.ChatRestoringContext;
import com.libragraph.backup.frames.ChatItem;
import com.libragraph.backup.types.model.ChatThread;
import com.libragraph.backup.types.model.Interaction;
import org.jdbi.v3.core.Handle;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Archiver whose predicates and results are supplied by the test.
 */
public class ScriptedArchiver implements InteractionArchiver {

    private final int priority;
    private final Predicate<Interaction> archives;
    private final Function<Interaction, InteractionArchiveResult> archiveResult;
    private Predicate<ChatItem> restores = c -> false;
    private InteractionRestoreResult restoreResult = InteractionRestoreResult.success();
    private RuntimeException restoreFault;
    private int archiveCalls;
    private int restoreCalls;
    private ChatThread lastThread;

    public ScriptedArchiver(int priority, Predicate<Interaction> archives,
                            Function<Interaction, InteractionArchiveResult> archiveResult) {
        this.priority = priority;
        this.archives = archives;
        this.archiveResult = archiveResult;
    }

    public static ScriptedArchiver restoring(Predicate<ChatItem> restores, InteractionRestoreResult result) {
        ScriptedArchiver archiver = new ScriptedArchiver(1, i -> false, i -> {
            throw new AssertionError("archive not expected");
        });
        archiver.restores = restores;
        archiver.restoreResult = result;
        return archiver;
    }

    /** Claims every chat item and throws {@code fault} from restore. */
    public static ScriptedArchiver failingRestore(RuntimeException fault) {
        ScriptedArchiver archiver = restoring(c -> true, InteractionRestoreResult.success());
        archiver.restoreFault = fault;
        return archiver;
    }

    public int archiveCalls() {
        return archiveCalls;
    }

    public int restoreCalls() {
        return restoreCalls;
    }

    public ChatThread lastThread() {
        return lastThread;
    }

    @Override
    public int priority() {
        return priority;
    }

    @Override
    public boolean canArchive(Interaction interaction) {
        return archives.test(interaction);
    }

    @Override
    public boolean canRestore(ChatItem chatItem) {
        return restores.test(chatItem);
    }

    @Override
    public InteractionArchiveResult archive(Interaction interaction, ChatArchivingContext context, Handle tx) {
        archiveCalls++;
        return archiveResult.apply(interaction);
    }

    @Override
    public InteractionRestoreResult restore(ChatItem chatItem, ChatThread thread, ChatRestoringContext context,
                                            Handle tx) {
        restoreCalls++;
        lastThread = thread;
        if (restoreFault != null) {
            throw restoreFault;
        }
        return restoreResult;
    }
}
