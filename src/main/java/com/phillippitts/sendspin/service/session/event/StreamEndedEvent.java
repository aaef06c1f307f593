package com.phillippitts.sendspin.service.session.event;

import java.time.Instant;

/**
 * Published when the active stream ends, either by stream/end or because its session closed.
 */
public record StreamEndedEvent(String sessionId, Instant at) { }
