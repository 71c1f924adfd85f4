package com.libragraph.backup.archivers.api;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of archiving one interaction with a variant.
 */
public sealed interface InteractionArchiveResult {

    record Success(ArchiveDetails details) implements InteractionArchiveResult {
        public Success {
            Objects.requireNonNull(details, "details cannot be null");
        }
    }

    /** The interaction is an earlier version of an edited message, archived with its latest revision. */
    record IsPastRevision() implements InteractionArchiveResult {}

    record NotYetImplemented() implements InteractionArchiveResult {}

    /** Nothing archivable; the errors are recorded and the pass continues. */
    record MessageFailure(List<ArchiveItemError> errors) implements InteractionArchiveResult {
        public MessageFailure {
            errors = List.copyOf(errors);
        }
    }

    /** Archivable with losses; the frame is still written. */
    record PartialFailure(ArchiveDetails details, List<ArchiveItemError> errors) implements InteractionArchiveResult {
        public PartialFailure {
            Objects.requireNonNull(details, "details cannot be null");
            errors = List.copyOf(errors);
        }
    }

    /** Aborts the whole pass. */
    record CompleteFailure(Throwable error) implements InteractionArchiveResult {
        public CompleteFailure {
            Objects.requireNonNull(error, "error cannot be null");
        }
    }

    static InteractionArchiveResult success(ArchiveDetails details) {
        return new Success(details);
    }

    static InteractionArchiveResult successOrPartial(ArchiveDetails details, List<ArchiveItemError> errors) {
        return errors.isEmpty() ? new Success(details) : new PartialFailure(details, errors);
    }

    static InteractionArchiveResult pastRevision() {
        return new IsPastRevision();
    }

    static InteractionArchiveResult notYetImplemented() {
        return new NotYetImplemented();
    }

    static InteractionArchiveResult messageFailure(List<ArchiveItemError> errors) {
        return new MessageFailure(errors);
    }

    static InteractionArchiveResult messageFailure(ArchiveItemError error) {
        return new MessageFailure(List.of(error));
    }

    static InteractionArchiveResult completeFailure(Throwable error) {
        return new CompleteFailure(error);
    }
}
