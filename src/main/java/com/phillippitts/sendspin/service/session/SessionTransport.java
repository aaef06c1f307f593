package com.phillippitts.sendspin.service.session;

import java.io.IOException;

/**
 * Outbound side of one controller connection.
 *
 * <p>Implementations must allow {@link #sendText(String)} from several threads (the receive
 * thread, the clock-sync scheduler and host calls).
 */
public interface SessionTransport {

    /** Stable id of the connection, used in logs and events. */
    String id();

    void sendText(String text) throws IOException;

    boolean isOpen();

    /** Closes the connection; a no-op when already closed. */
    void close();
}
