package org.dballot.util;


import java.time.Instant;

/**
 * Utility class for working with Unix timestamps.
 */
public class TimeUtil {

    /**
     * Returns the current Unix timestamp in seconds.
     *
     * @return current Unix time in seconds
     */
    public static long getCurrentUnixTime() {
        return Instant.now().getEpochSecond();
    }

    /**
     * Checks whether two timestamps lie at most {@code seconds} apart, in either direction.
     *
     * @param timestamp   The Unix timestamp to check.
     * @param currentTime The reference Unix timestamp.
     * @param seconds     The allowed skew in seconds.
     * @return true if |currentTime - timestamp| <= seconds
     */
    public static boolean isWithinSeconds(long timestamp, long currentTime, long seconds) {
        return Math.abs(currentTime - timestamp) <= seconds;
    }
}
