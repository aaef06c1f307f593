package com.phillippitts.sendspin.util;

/**
 * Conversions between the microsecond timeline used on the wire and the millisecond
 * granularity used for sleeping and logging.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /** Number of microseconds in one millisecond. */
    public static final long MICROS_PER_MILLI = 1_000L;

    /** Number of microseconds in one second. */
    public static final long MICROS_PER_SECOND = 1_000_000L;

    /** Number of nanoseconds in one microsecond. */
    public static final long NANOS_PER_MICRO = 1_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts microseconds to milliseconds (truncated toward zero).
     *
     * @param micros time in microseconds
     * @return time in milliseconds
     */
    public static long microsToMillis(long micros) {
        return micros / MICROS_PER_MILLI;
    }

    /**
     * Converts milliseconds to microseconds.
     *
     * @param millis time in milliseconds
     * @return time in microseconds
     */
    public static long millisToMicros(long millis) {
        return millis * MICROS_PER_MILLI;
    }

    /**
     * Duration of {@code bytes} of PCM audio in microseconds.
     *
     * @param bytes payload length
     * @param byteRate bytes per second of the stream
     * @return playback duration in microseconds, 0 when byteRate is not positive
     */
    public static long pcmDurationMicros(long bytes, int byteRate) {
        if (byteRate <= 0) {
            return 0;
        }
        return bytes * MICROS_PER_SECOND / byteRate;
    }
}
