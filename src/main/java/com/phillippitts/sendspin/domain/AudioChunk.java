package com.phillippitts.sendspin.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * One timestamped unit of raw PCM received from the controller.
 *
 * <p>Chunks are never mutated after decode; {@link #data()} returns the backing array
 * without copying, so callers must treat it as read-only.
 *
 * @param timestampMicros play time on the controller clock, in microseconds
 * @param data raw PCM payload
 */
public record AudioChunk(long timestampMicros, byte[] data) {

    public AudioChunk {
        Objects.requireNonNull(data, "data must not be null");
    }

    /** Payload length in bytes. */
    public int size() {
        return data.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AudioChunk other)) {
            return false;
        }
        return timestampMicros == other.timestampMicros && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(timestampMicros) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "AudioChunk[timestampMicros=" + timestampMicros + ", size=" + data.length + "]";
    }
}
