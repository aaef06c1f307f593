package com.phillippitts.sendspin.testutil;

import com.phillippitts.sendspin.domain.AudioChunk;
import com.phillippitts.sendspin.service.playback.AudioOutput;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records writes instead of playing them.
 */
public class FakeAudioOutput implements AudioOutput {
    private final int bufferSize;
    private final long latencyMicros;
    private final List<byte[]> writes = new CopyOnWriteArrayList<>();
    private volatile boolean started;
    private volatile boolean stopped;
    private volatile boolean released;
    private volatile float volume = -1f;
    private volatile boolean failWrites;

    public FakeAudioOutput(int bufferSize, long latencyMicros) {
        this.bufferSize = bufferSize;
        this.latencyMicros = latencyMicros;
    }

    @Override
    public void start() {
        started = true;
    }

    @Override
    public int write(byte[] data, int offset, int length) {
        if (failWrites) {
            throw new IllegalStateException("simulated device failure");
        }
        writes.add(Arrays.copyOfRange(data, offset, offset + length));
        return length;
    }

    @Override
    public void stop() {
        stopped = true;
    }

    @Override
    public void release() {
        released = true;
    }

    @Override
    public void setVolume(float volume) {
        this.volume = volume;
    }

    @Override
    public long latencyMicros() {
        return latencyMicros;
    }

    @Override
    public int bufferSizeBytes() {
        return bufferSize;
    }

    public void failWrites(boolean fail) {
        this.failWrites = fail;
    }

    public List<byte[]> writes() {
        return List.copyOf(writes);
    }

    public boolean wrote(AudioChunk chunk) {
        return writes.stream().anyMatch(w -> Arrays.equals(w, chunk.data()));
    }

    public boolean isStarted() {
        return started;
    }

    public boolean isStopped() {
        return stopped;
    }

    public boolean isReleased() {
        return released;
    }

    public float volume() {
        return volume;
    }
}
