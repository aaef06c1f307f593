package com.phillippitts.sendspin.service.session.event;

import java.time.Instant;

/**
 * Published when a session is torn down because of a transport failure.
 *
 * Payload contains a short reason and timestamp. Avoids any PII.
 */
public record SessionErrorEvent(String sessionId, String reason, Instant at) { }
