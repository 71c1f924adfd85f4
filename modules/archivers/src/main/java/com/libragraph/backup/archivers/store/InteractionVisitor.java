package com.libragraph.backup.archivers.store;

import com.libragraph.backup.types.model.Interaction;

/**
 * Receives interactions one at a time during enumeration.
 */
@FunctionalInterface
public interface InteractionVisitor {

    enum VisitResult {
        CONTINUE,
        STOP
    }

    VisitResult visit(Interaction interaction);
}
