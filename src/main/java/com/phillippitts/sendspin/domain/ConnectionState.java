package com.phillippitts.sendspin.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one controller session.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * DISCONNECTED → CONNECTING (session opened)
 * CONNECTING → HANDSHAKING (client/hello sent)
 * HANDSHAKING → SYNCING_CLOCK (server/hello received)
 * SYNCING_CLOCK → CONNECTED (clock synchronized)
 * CONNECTED → STREAMING (stream/start)
 * STREAMING → STREAMING (stream/start with a new format)
 * STREAMING → CONNECTED (stream/end)
 * any non-terminal state → ERROR (transport failure)
 * any state → DISCONNECTED (teardown)
 * </pre>
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    HANDSHAKING,
    SYNCING_CLOCK,
    CONNECTED,
    STREAMING,
    ERROR;

    /**
     * Returns whether moving from this state to {@code next} is a legal transition.
     *
     * @param next target state
     * @return {@code true} if the transition is allowed
     */
    public boolean canTransitionTo(ConnectionState next) {
        return successors().contains(next);
    }

    /** Connected to a controller with a synchronized clock (streaming or idle). */
    public boolean isOperational() {
        return this == CONNECTED || this == STREAMING;
    }

    private Set<ConnectionState> successors() {
        return switch (this) {
            case DISCONNECTED -> EnumSet.of(CONNECTING);
            case CONNECTING -> EnumSet.of(HANDSHAKING, ERROR, DISCONNECTED);
            case HANDSHAKING -> EnumSet.of(SYNCING_CLOCK, ERROR, DISCONNECTED);
            case SYNCING_CLOCK -> EnumSet.of(CONNECTED, ERROR, DISCONNECTED);
            case CONNECTED -> EnumSet.of(STREAMING, ERROR, DISCONNECTED);
            case STREAMING -> EnumSet.of(STREAMING, CONNECTED, ERROR, DISCONNECTED);
            case ERROR -> EnumSet.of(DISCONNECTED);
        };
    }
}
