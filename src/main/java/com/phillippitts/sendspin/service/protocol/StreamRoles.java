package com.phillippitts.sendspin.service.protocol;

import java.util.List;

/**
 * Roles addressed by stream/clear or stream/end.
 *
 * @param roles addressed roles, or {@code null} when the payload named none
 */
public record StreamRoles(List<String> roles) {

    public static final String PLAYER = "player";

    public StreamRoles {
        roles = roles == null ? null : List.copyOf(roles);
    }

    /** Only messages that name the player role are acted on. */
    public boolean appliesToPlayer() {
        return roles != null && roles.contains(PLAYER);
    }
}
