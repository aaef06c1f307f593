package com.phillippitts.sendspin.service.discovery;

import java.io.IOException;

/**
 * Publishes the player as a DNS-SD service so controllers can find it.
 * Tests should inject a fake advertiser and inspect what was registered.
 */
public interface ServiceAdvertiser {

    /**
     * Registers (or re-registers under a new name) the player's service record.
     *
     * @param instanceName service instance name, normally the device name
     * @param port WebSocket port
     * @param path WebSocket path, published as the {@code path} TXT record
     * @throws IOException if the responder cannot be started or the record not announced
     */
    void register(String instanceName, int port, String path) throws IOException;

    /** Withdraws the record and stops the responder. A no-op when nothing is registered. */
    void unregister();

    boolean isRegistered();
}
