package com.phillippitts.sendspin.service.protocol;

import com.phillippitts.sendspin.domain.StreamConfig;

/**
 * One {@code (codec, channels, sample_rate, bit_depth)} tuple from player_support.
 */
public record SupportedFormat(String codec, int channels, int sampleRate, int bitDepth) {

    /** Returns whether a stream announced by the controller has exactly this format. */
    public boolean matches(StreamConfig config) {
        return codec.equals(config.codec())
                && channels == config.channels()
                && sampleRate == config.sampleRate()
                && bitDepth == config.bitDepth();
    }
}
