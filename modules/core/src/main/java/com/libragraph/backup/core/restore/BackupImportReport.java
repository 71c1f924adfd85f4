package com.libragraph.backup.core.restore;

import com.libragraph.backup.archivers.api.RestoreFrameResult;

import java.util.List;

/**
 * Summary of one import run.
 *
 * @param restored chat items restored completely, or skipped as unsupported
 * @param problems the partial restores and failures, in stream order
 */
public record BackupImportReport(int recipients, int chats, long restored, List<RestoreFrameResult> problems) {

    public BackupImportReport {
        problems = List.copyOf(problems);
    }

    public long failed() {
        return problems.stream().filter(RestoreFrameResult.Failure.class::isInstance).count();
    }

    public long partiallyRestored() {
        return problems.stream().filter(RestoreFrameResult.PartialRestore.class::isInstance).count();
    }
}
