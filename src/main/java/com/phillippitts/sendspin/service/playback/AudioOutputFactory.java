package com.phillippitts.sendspin.service.playback;

import com.phillippitts.sendspin.domain.StreamConfig;
import com.phillippitts.sendspin.exception.AudioDeviceException;

/**
 * Creates output devices for a stream format.
 *
 * <p>This is the seam tests replace with an in-memory output.
 */
public interface AudioOutputFactory {

    /**
     * Smallest device buffer that plays {@code config} without underruns, in bytes.
     *
     * @throws AudioDeviceException if no device supports the format
     */
    int minBufferSize(StreamConfig config);

    /**
     * Opens a device for {@code config} with the given buffer size. The device is not started.
     *
     * @throws AudioDeviceException if the device cannot be opened
     */
    AudioOutput open(StreamConfig config, int bufferSizeBytes);
}
