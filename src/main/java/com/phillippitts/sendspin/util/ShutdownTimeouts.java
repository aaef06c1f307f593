package com.phillippitts.sendspin.util;

import java.time.Duration;

/**
 * Standard timeout values for thread and device teardown.
 *
 * <p><b>Usage:</b> Used by {@link com.phillippitts.sendspin.service.playback.PlaybackEngine}.
 *
 * @since 1.0
 */
public final class ShutdownTimeouts {

    /**
     * Timeout for the playback thread to exit after stop was requested.
     *
     * <p>The loop sleeps at most 500ms between checks, so one second covers a full sleep
     * plus a blocking device write.
     */
    public static final Duration PLAYBACK_THREAD_STOP_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Timeout for the playback thread during application shutdown (best-effort).
     *
     * <p>The thread is a daemon; the JVM reclaims it if it does not respond.
     */
    public static final Duration PLAYBACK_THREAD_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    private ShutdownTimeouts() {
        // Utility class - prevent instantiation
    }
}
