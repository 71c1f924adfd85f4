package com.libragraph.backup.archivers.api;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-pass accounting of an archive run.
 *
 * <p>For a pass that ran to completion, every enumerated interaction is counted exactly
 * once: {@code enumerated == framesWritten + skippedTotal() + failed}.
 */
public record ArchiveTally(long enumerated, long framesWritten, Map<SkipReason, Long> skipped, long failed) {

    public ArchiveTally {
        EnumMap<SkipReason, Long> copy = new EnumMap<>(SkipReason.class);
        copy.putAll(skipped);
        skipped = Collections.unmodifiableMap(copy);
    }

    public static ArchiveTally empty() {
        return new ArchiveTally(0, 0, Map.of(), 0);
    }

    public long skipped(SkipReason reason) {
        return skipped.getOrDefault(reason, 0L);
    }

    public long skippedTotal() {
        return skipped.values().stream().mapToLong(Long::longValue).sum();
    }

    public boolean isBalanced() {
        return enumerated == framesWritten + skippedTotal() + failed;
    }

    /**
     * Mutable counterpart used while a pass is running.
     */
    public static final class Counter {

        private long enumerated;
        private long framesWritten;
        private final EnumMap<SkipReason, Long> skipped = new EnumMap<>(SkipReason.class);
        private long failed;

        public void enumerated() {
            enumerated++;
        }

        public void written() {
            framesWritten++;
        }

        public void skipped(SkipReason reason) {
            skipped.merge(reason, 1L, Long::sum);
        }

        public void failed() {
            failed++;
        }

        public ArchiveTally snapshot() {
            return new ArchiveTally(enumerated, framesWritten, skipped, failed);
        }
    }
}
