package com.phillippitts.sendspin.exception;

/**
 * Thrown when the audio output device cannot be created or configured for a stream
 * (unsupported format, line unavailable, permission denied).
 *
 * <p>Fatal to the stream attempt only; the playback engine stays idle until the next stream/start.
 */
public class AudioDeviceException extends SendspinException {

    private final String reason;

    public AudioDeviceException(String reason, String message) {
        super(message + " (reason: " + reason + ")");
        this.reason = reason;
    }

    public AudioDeviceException(String reason, String message, Throwable cause) {
        super(message + " (reason: " + reason + ")", cause);
        this.reason = reason;
    }

    /** Short machine-readable reason, e.g. UNSUPPORTED_FORMAT or LINE_UNAVAILABLE. */
    public String getReason() {
        return reason;
    }
}
