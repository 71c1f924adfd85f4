package com.libragraph.backup.archivers.variants;

import com.libragraph.backup.archivers.api.ArchiveDetails;
import com.libragraph.backup.archivers.api.InteractionArchiveResult;
import com.libragraph.backup.archivers.api.InteractionArchiver;
import com.libragraph.backup.archivers.api.InteractionRestoreResult;
import com.libragraph.backup.archivers.api.RestoreFrameError;
import com.libragraph.backup.archivers.context.ChatArchivingContext;
import com.libragraph.backup.archivers.context.ChatRestoringContext;
import com.libragraph.backup.archivers.store.InteractionStore;
import com.libragraph.backup.archivers.store.InteractionStoreException;
import com.libragraph.backup.frames.ChatItem;
import com.libragraph.backup.frames.ChatItemPayload;
import com.libragraph.backup.frames.DirectionalDetails;
import com.libragraph.backup.types.model.ChatThread;
import com.libragraph.backup.types.model.InfoMessage;
import com.libragraph.backup.types.model.Interaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Handle;

import java.util.List;
import java.util.UUID;

/**
 * Chat update events. Kinds without a backup representation are reported as not yet
 * implemented and skipped.
 */
@ApplicationScoped
public class InfoMessageArchiver implements InteractionArchiver {

    public static final int PRIORITY = 100;

    private final InteractionStore interactionStore;

    @Inject
    public InfoMessageArchiver(InteractionStore interactionStore) {
        this.interactionStore = interactionStore;
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean canArchive(Interaction interaction) {
        return interaction instanceof InfoMessage;
    }

    @Override
    public boolean canRestore(ChatItem chatItem) {
        return chatItem.directional() instanceof DirectionalDetails.Directionless
                && chatItem.payload() instanceof ChatItemPayload.ChatUpdateMessage;
    }

    @Override
    public InteractionArchiveResult archive(Interaction interaction, ChatArchivingContext context, Handle tx) {
        InfoMessage info = (InfoMessage) interaction;
        if (!info.type().archivable()) {
            return InteractionArchiveResult.notYetImplemented();
        }
        return InteractionArchiveResult.success(new ArchiveDetails(
                context.localRecipientId(),
                DirectionalDetails.directionless(),
                new ChatItemPayload.ChatUpdateMessage(info.type(), info.detail()),
                null,
                null,
                false,
                false,
                List.of()));
    }

    @Override
    public InteractionRestoreResult restore(ChatItem chatItem, ChatThread thread, ChatRestoringContext context,
                                            Handle tx) {
        ChatItemPayload.ChatUpdateMessage update = (ChatItemPayload.ChatUpdateMessage) chatItem.payload();
        InfoMessage info = new InfoMessage(0, UUID.randomUUID().toString(), thread.uniqueId(),
                chatItem.dateSent(), update.updateType(), update.detail());
        try {
            interactionStore.insert(info, tx);
        } catch (InteractionStoreException e) {
            return InteractionRestoreResult.messageFailure(RestoreFrameError.insertionFailed(e));
        }
        return InteractionRestoreResult.success();
    }
}
