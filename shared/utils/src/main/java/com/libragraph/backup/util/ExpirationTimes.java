package com.libragraph.backup.util;

import java.util.concurrent.TimeUnit;

/**
 * Conversions between the local disappearing-timer representation
 * (start millis, 0 = not started; duration seconds, 0 = no timer)
 * and the nullable millisecond fields of a backup record.
 */
public final class ExpirationTimes {

    private ExpirationTimes() {
    }

    /** Returns the start time, or null if the timer has not started. */
    public static Long startMillisOrNull(long expireStartedAt) {
        return expireStartedAt > 0 ? expireStartedAt : null;
    }

    /** Returns the duration in millis, or null if the message does not expire. */
    public static Long durationMillisOrNull(int expiresInSeconds) {
        return expiresInSeconds > 0 ? TimeUnit.SECONDS.toMillis(expiresInSeconds) : null;
    }

    public static long startMillisOrZero(Long expireStartDate) {
        return expireStartDate == null ? 0L : expireStartDate;
    }

    /** Returns whether a backup duration converts to local seconds without overflow. */
    public static boolean fitsLocalDuration(Long expiresInMs) {
        return expiresInMs == null || expiresInMs <= 0 || secondsRoundedUp(expiresInMs) <= Integer.MAX_VALUE;
    }

    /**
     * Returns the duration in seconds, rounded up, or 0 if absent.
     * A sub-second timer stays a timer.
     *
     * @throws IllegalArgumentException if the duration does not fit the local representation
     */
    public static int durationSecondsOrZero(Long expiresInMs) {
        if (expiresInMs == null || expiresInMs <= 0) {
            return 0;
        }
        long seconds = secondsRoundedUp(expiresInMs);
        if (seconds > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Expiration timer too large: " + expiresInMs + "ms");
        }
        return (int) seconds;
    }

    private static long secondsRoundedUp(long millis) {
        return TimeUnit.MILLISECONDS.toSeconds(millis) + (millis % 1_000 == 0 ? 0 : 1);
    }
}
