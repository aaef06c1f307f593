package com.phillippitts.sendspin.service.session.event;

import java.time.Instant;

/**
 * Published when the controller mutes or unmutes the player via server/command.
 */
public record MuteChangedEvent(String sessionId, boolean muted, Instant at) { }
