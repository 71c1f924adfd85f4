package com.libragraph.backup.core.export;

import com.libragraph.backup.archivers.api.ArchiveItemError;
import com.libragraph.backup.archivers.api.ArchiveMultiFrameResult;
import com.libragraph.backup.archivers.api.ArchiveTally;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Summary of one export run.
 *
 * @param recipients recipient frames written, the local account included
 * @param chats      chat frames written
 */
public record BackupExportReport(int recipients, int chats, ArchiveMultiFrameResult result) {

    public BackupExportReport {
        Objects.requireNonNull(result, "result cannot be null");
    }

    /** False when the archive pass stopped early; the written stream should then be discarded. */
    public boolean isComplete() {
        return !(result instanceof ArchiveMultiFrameResult.CompleteFailure);
    }

    public List<ArchiveItemError> errors() {
        if (result instanceof ArchiveMultiFrameResult.PartialSuccess partial) {
            return partial.errors();
        }
        return List.of();
    }

    public Optional<ArchiveTally> tally() {
        if (result instanceof ArchiveMultiFrameResult.Success success) {
            return Optional.of(success.tally());
        }
        if (result instanceof ArchiveMultiFrameResult.PartialSuccess partial) {
            return Optional.of(partial.tally());
        }
        return Optional.empty();
    }
}
