package com.libragraph.backup.archivers;

import com.libragraph.backup.archivers.api.InteractionArchiver;
import com.libragraph.backup.frames.ChatItem;
import com.libragraph.backup.types.model.Interaction;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds the interaction archivers in dispatch order.
 * All {@link InteractionArchiver} beans are discovered via CDI.
 */
@ApplicationScoped
public class InteractionArchiverRegistry {

    private static final Logger log = Logger.getLogger(InteractionArchiverRegistry.class);

    @Inject
    Instance<InteractionArchiver> candidates;

    private List<InteractionArchiver> archivers = List.of();

    @PostConstruct
    void init() {
        register(candidates);
    }

    /** Builds a registry outside the container. */
    public static InteractionArchiverRegistry of(InteractionArchiver... archivers) {
        InteractionArchiverRegistry registry = new InteractionArchiverRegistry();
        registry.register(List.of(archivers));
        return registry;
    }

    void register(Iterable<? extends InteractionArchiver> found) {
        Map<Integer, InteractionArchiver> byPriority = new HashMap<>();
        List<InteractionArchiver> sorted = new ArrayList<>();
        for (InteractionArchiver archiver : found) {
            InteractionArchiver existing = byPriority.put(archiver.priority(), archiver);
            if (existing != null) {
                throw new IllegalStateException(
                        "Duplicate archiver priority " + archiver.priority() + ": " +
                                existing.getClass().getName() + " and " + archiver.getClass().getName());
            }
            sorted.add(archiver);
        }
        sorted.sort(Comparator.comparingInt(InteractionArchiver::priority).reversed());
        this.archivers = List.copyOf(sorted);
        for (InteractionArchiver archiver : archivers) {
            log.debugf("Registered archiver: %d → %s", archiver.priority(), archiver.getClass().getSimpleName());
        }
        log.infof("InteractionArchiverRegistry initialized with %d archivers", archivers.size());
    }

    /** The first archiver, in priority order, that accepts the interaction. */
    public Optional<InteractionArchiver> findArchiver(Interaction interaction) {
        return archivers.stream().filter(a -> a.canArchive(interaction)).findFirst();
    }

    /** The first archiver, in priority order, that accepts the chat item. */
    public Optional<InteractionArchiver> findRestorer(ChatItem chatItem) {
        return archivers.stream().filter(a -> a.canRestore(chatItem)).findFirst();
    }

    public List<InteractionArchiver> archivers() {
        return archivers;
    }
}
