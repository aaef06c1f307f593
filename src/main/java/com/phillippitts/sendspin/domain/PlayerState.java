package com.phillippitts.sendspin.domain;

import java.util.Objects;

/**
 * Immutable snapshot of what the player looks like to the host application.
 *
 * <p>Snapshots are swapped atomically by {@code PlayerStateHolder}; readers never see a
 * half-applied update. The {@code with*} methods return modified copies.
 *
 * @param connectionState current session state
 * @param serverId controller id from server/hello, or {@code null}
 * @param serverName controller display name from server/hello, or {@code null}
 * @param clockOffsetMicros last published clock offset, or {@code null} before the first sample
 * @param clockSynced whether enough clock samples were collected
 * @param streamActive whether a stream is between stream/start and stream/end
 * @param codec codec of the active stream, or {@code null}
 * @param sampleRate sample rate of the active stream, or {@code null}
 * @param channels channel count of the active stream, or {@code null}
 * @param volume volume on the protocol scale 0-100
 * @param muted mute flag
 * @param bufferHealthPercent ring buffer usage in percent
 * @param errorMessage message of the last session failure, or {@code null}
 */
public record PlayerState(
        ConnectionState connectionState,
        String serverId,
        String serverName,
        Long clockOffsetMicros,
        boolean clockSynced,
        boolean streamActive,
        String codec,
        Integer sampleRate,
        Integer channels,
        int volume,
        boolean muted,
        float bufferHealthPercent,
        String errorMessage
) {

    public static final int MAX_VOLUME = 100;

    public PlayerState {
        Objects.requireNonNull(connectionState, "connectionState must not be null");
        if (volume < 0 || volume > MAX_VOLUME) {
            throw new IllegalArgumentException("Volume must be between 0 and 100, got: " + volume);
        }
    }

    /** Initial state: disconnected, full volume, unmuted. */
    public static PlayerState initial() {
        return new PlayerState(ConnectionState.DISCONNECTED, null, null, null, false, false,
                null, null, null, MAX_VOLUME, false, 0f, null);
    }

    public PlayerState withConnectionState(ConnectionState state) {
        return new PlayerState(state, serverId, serverName, clockOffsetMicros, clockSynced, streamActive,
                codec, sampleRate, channels, volume, muted, bufferHealthPercent, errorMessage);
    }

    public PlayerState withServer(String id, String name) {
        return new PlayerState(connectionState, id, name, clockOffsetMicros, clockSynced, streamActive,
                codec, sampleRate, channels, volume, muted, bufferHealthPercent, errorMessage);
    }

    public PlayerState withClock(long offsetMicros, boolean synced) {
        return new PlayerState(connectionState, serverId, serverName, offsetMicros, synced, streamActive,
                codec, sampleRate, channels, volume, muted, bufferHealthPercent, errorMessage);
    }

    /** Clears the clock fields after the synchronizer was reset. */
    public PlayerState withClockReset() {
        return new PlayerState(connectionState, serverId, serverName, null, false, streamActive,
                codec, sampleRate, channels, volume, muted, bufferHealthPercent, errorMessage);
    }

    /** Marks a stream active with the given format, or inactive when {@code config} is null. */
    public PlayerState withStream(StreamConfig config) {
        if (config == null) {
            return new PlayerState(connectionState, serverId, serverName, clockOffsetMicros, clockSynced,
                    false, null, null, null, volume, muted, bufferHealthPercent, errorMessage);
        }
        return new PlayerState(connectionState, serverId, serverName, clockOffsetMicros, clockSynced,
                true, config.codec(), config.sampleRate(), config.channels(), volume, muted,
                bufferHealthPercent, errorMessage);
    }

    public PlayerState withVolume(int newVolume) {
        return new PlayerState(connectionState, serverId, serverName, clockOffsetMicros, clockSynced,
                streamActive, codec, sampleRate, channels, newVolume, muted, bufferHealthPercent, errorMessage);
    }

    public PlayerState withMuted(boolean newMuted) {
        return new PlayerState(connectionState, serverId, serverName, clockOffsetMicros, clockSynced,
                streamActive, codec, sampleRate, channels, volume, newMuted, bufferHealthPercent, errorMessage);
    }

    public PlayerState withBufferHealth(float percent) {
        return new PlayerState(connectionState, serverId, serverName, clockOffsetMicros, clockSynced,
                streamActive, codec, sampleRate, channels, volume, muted, percent, errorMessage);
    }

    public PlayerState withError(String message) {
        return new PlayerState(connectionState, serverId, serverName, clockOffsetMicros, clockSynced,
                streamActive, codec, sampleRate, channels, volume, muted, bufferHealthPercent, message);
    }
}
