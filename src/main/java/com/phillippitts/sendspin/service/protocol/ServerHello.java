package com.phillippitts.sendspin.service.protocol;

import java.util.List;

/**
 * Payload of server/hello.
 *
 * @param serverId controller id
 * @param name controller display name
 * @param version protocol version spoken by the controller
 * @param activeRoles roles the controller activated for this client
 * @param connectionReason why the controller connected (e.g. "discovery", "playback"), may be null
 */
public record ServerHello(String serverId, String name, int version, List<String> activeRoles,
                          String connectionReason) {

    public ServerHello {
        activeRoles = activeRoles == null ? List.of() : List.copyOf(activeRoles);
    }
}
