package com.phillippitts.sendspin.service.session.event;

import java.time.Instant;

/**
 * Published when the controller changes the volume via server/command.
 *
 * @param volume new volume 0-100
 */
public record VolumeChangedEvent(String sessionId, int volume, Instant at) { }
