package com.phillippitts.sendspin.service.health;

import com.phillippitts.sendspin.domain.ConnectionState;
import com.phillippitts.sendspin.domain.PlayerState;
import com.phillippitts.sendspin.service.orchestration.SendspinPlayerService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the player.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: player running, connected or waiting for a controller</li>
 *   <li>DEGRADED: the last session ended with an error</li>
 *   <li>DOWN: player not running</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class SendspinHealthIndicator implements HealthIndicator {

    private final SendspinPlayerService player;

    public SendspinHealthIndicator(SendspinPlayerService player) {
        this.player = player;
    }

    @Override
    public Health health() {
        PlayerState s = player.getPlayerState();
        Health.Builder builder;
        if (!player.isRunning()) {
            builder = Health.down().withDetail("status", "Player not running");
        } else if (s.connectionState() == ConnectionState.DISCONNECTED && s.errorMessage() != null) {
            builder = Health.status("DEGRADED").withDetail("lastError", s.errorMessage());
        } else {
            builder = Health.up();
        }
        builder.withDetail("connectionState", s.connectionState().name())
                .withDetail("clockSynced", s.clockSynced())
                .withDetail("streamActive", s.streamActive())
                .withDetail("bufferHealthPercent", Math.round(s.bufferHealthPercent()));
        if (s.serverName() != null) {
            builder.withDetail("server", s.serverName());
        }
        return builder.build();
    }
}
