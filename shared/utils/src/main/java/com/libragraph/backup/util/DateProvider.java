package com.libragraph.backup.util;

import java.time.Instant;

/**
 * Supplies the current time. Injected wherever "now" matters so tests can pin it.
 */
@FunctionalInterface
public interface DateProvider {

    Instant now();

    default long nowMillis() {
        return now().toEpochMilli();
    }

    static DateProvider system() {
        return Instant::now;
    }

    static DateProvider fixed(Instant instant) {
        return () -> instant;
    }
}
