package com.phillippitts.sendspin.service.playback;

import com.phillippitts.sendspin.domain.StreamConfig;

import java.time.Instant;

/**
 * Published when the output device cannot be opened for a stream (unsupported format,
 * line unavailable, permission denied). Playback stays idle until the next stream/start.
 */
public record AudioDeviceErrorEvent(String reason, StreamConfig config, Instant at) { }
