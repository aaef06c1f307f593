package com.phillippitts.sendspin.service.session.event;

import com.phillippitts.sendspin.domain.StreamConfig;

import java.time.Instant;

/**
 * Published when the controller starts a stream (stream/start). The buffer was cleared
 * before publication.
 */
public record StreamStartedEvent(String sessionId, StreamConfig config, Instant at) { }
