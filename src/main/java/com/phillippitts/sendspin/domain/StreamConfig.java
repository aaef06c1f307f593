package com.phillippitts.sendspin.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * Audio format announced by the controller in {@code stream/start}.
 *
 * @param codec codec identifier ("pcm", "opus", "flac")
 * @param sampleRate sample rate in Hz
 * @param channels channel count
 * @param bitDepth bits per sample
 * @param codecHeader decoded codec header, or {@code null} when the controller sent none
 */
public record StreamConfig(
        String codec,
        int sampleRate,
        int channels,
        int bitDepth,
        byte[] codecHeader
) {

    public StreamConfig {
        Objects.requireNonNull(codec, "codec must not be null");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("Sample rate must be positive, got: " + sampleRate);
        }
        if (channels <= 0) {
            throw new IllegalArgumentException("Channel count must be positive, got: " + channels);
        }
        if (bitDepth <= 0) {
            throw new IllegalArgumentException("Bit depth must be positive, got: " + bitDepth);
        }
        codecHeader = codecHeader == null ? null : codecHeader.clone();
    }

    public StreamConfig(String codec, int sampleRate, int channels, int bitDepth) {
        this(codec, sampleRate, channels, bitDepth, null);
    }

    @Override
    public byte[] codecHeader() {
        return codecHeader == null ? null : codecHeader.clone();
    }

    /** Bytes per PCM frame (one sample for every channel). */
    public int frameSize() {
        return ((bitDepth + 7) / 8) * channels;
    }

    /** Bytes per second of PCM at this format. */
    public int byteRate() {
        return frameSize() * sampleRate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StreamConfig other)) {
            return false;
        }
        return sampleRate == other.sampleRate
                && channels == other.channels
                && bitDepth == other.bitDepth
                && codec.equals(other.codec)
                && Arrays.equals(codecHeader, other.codecHeader);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(codec, sampleRate, channels, bitDepth);
        return 31 * result + Arrays.hashCode(codecHeader);
    }

    @Override
    public String toString() {
        return "StreamConfig[codec=" + codec + ", sampleRate=" + sampleRate + ", channels=" + channels
                + ", bitDepth=" + bitDepth + ", codecHeader="
                + (codecHeader == null ? "none" : codecHeader.length + " bytes") + "]";
    }
}
