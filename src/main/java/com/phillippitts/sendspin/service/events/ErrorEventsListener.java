package com.phillippitts.sendspin.service.events;

import com.phillippitts.sendspin.service.playback.AudioDeviceErrorEvent;
import com.phillippitts.sendspin.service.session.event.SessionErrorEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for user-facing error events. Throttled to avoid log spam when a
 * controller keeps retrying a format the device cannot open.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onAudioDeviceError(AudioDeviceErrorEvent e) {
        String key = "device-" + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Audio output unavailable: reason={}, format={}. Check the output device and "
                    + "that it supports {}-bit PCM.", e.reason(), e.config(),
                    e.config() == null ? "?" : e.config().bitDepth());
        }
    }

    @EventListener
    void onSessionError(SessionErrorEvent e) {
        if (shouldLog("session-error")) {
            LOG.warn("Controller session {} ended with an error: {}. Waiting for the controller to reconnect.",
                    e.sessionId(), e.reason());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
