package com.libragraph.backup.core.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Duration;

/**
 * Reads backup settings from {@code backup.*} properties.
 */
@ApplicationScoped
public class BackupConfig {

    /** Items expiring sooner than this after the backup is taken are not written. */
    @ConfigProperty(name = "backup.archive.min-expire-timer", defaultValue = "PT24H")
    Duration minExpireTimer;

    /** Report interactions and chat items no archiver accepts as errors instead of skipping them. */
    @ConfigProperty(name = "backup.archive.strict-unsupported", defaultValue = "false")
    boolean strictUnsupported;

    /** Report partially restored chat items as partial restores instead of failures. */
    @ConfigProperty(name = "backup.restore.preserve-partial", defaultValue = "false")
    boolean preservePartial;

    /** Address of the local account; recorded as the self recipient. */
    @ConfigProperty(name = "backup.account.local-address")
    String localAddress;

    /** Builds a config outside the container. */
    public static BackupConfig of(Duration minExpireTimer, boolean strictUnsupported, boolean preservePartial,
                                  String localAddress) {
        BackupConfig config = new BackupConfig();
        config.minExpireTimer = minExpireTimer;
        config.strictUnsupported = strictUnsupported;
        config.preservePartial = preservePartial;
        config.localAddress = localAddress;
        return config;
    }

    public Duration minExpireTimer() {
        return minExpireTimer;
    }

    public boolean strictUnsupported() {
        return strictUnsupported;
    }

    public boolean preservePartial() {
        return preservePartial;
    }

    public String localAddress() {
        return localAddress;
    }
}
