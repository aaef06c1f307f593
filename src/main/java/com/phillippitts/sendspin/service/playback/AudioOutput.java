package com.phillippitts.sendspin.service.playback;

/**
 * An opened output device for one stream.
 *
 * <p>Used only by the playback thread, except {@link #setVolume(float)}, {@link #stop()} and
 * {@link #release()} which may be called from any thread.
 */
public interface AudioOutput {

    void start();

    /**
     * Writes PCM bytes, blocking until the device accepted them.
     *
     * @return bytes written, negative on a device error
     */
    int write(byte[] data, int offset, int length);

    /** Stops output and discards what the device still holds. */
    void stop();

    /** Frees the device. The output cannot be used afterwards. */
    void release();

    /** @param volume linear gain in [0, 1] */
    void setVolume(float volume);

    /** Estimated time between a write and the samples being heard, in microseconds. */
    long latencyMicros();

    int bufferSizeBytes();
}
