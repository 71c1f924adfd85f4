package com.libragraph.backup.archivers.api;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one archive pass over every interaction.
 */
public sealed interface ArchiveMultiFrameResult {

    record Success(ArchiveTally tally) implements ArchiveMultiFrameResult {}

    record PartialSuccess(List<ArchiveItemError> errors, ArchiveTally tally) implements ArchiveMultiFrameResult {
        public PartialSuccess {
            errors = List.copyOf(errors);
            if (errors.isEmpty()) {
                throw new IllegalArgumentException("partial success needs at least one error");
            }
        }
    }

    record CompleteFailure(Throwable error) implements ArchiveMultiFrameResult {
        public CompleteFailure {
            Objects.requireNonNull(error, "error cannot be null");
        }
    }

    static ArchiveMultiFrameResult of(List<ArchiveItemError> errors, ArchiveTally tally) {
        return errors.isEmpty() ? new Success(tally) : new PartialSuccess(errors, tally);
    }

    static ArchiveMultiFrameResult completeFailure(Throwable error) {
        return new CompleteFailure(error);
    }
}
