package com.phillippitts.sendspin.service.health;

import com.phillippitts.sendspin.domain.ConnectionState;
import com.phillippitts.sendspin.domain.PlayerState;
import com.phillippitts.sendspin.domain.StreamConfig;
import com.phillippitts.sendspin.service.orchestration.SendspinPlayerService;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SendspinHealthIndicatorTest {

    @Test
    void shouldReportDownWhenNotRunning() {
        SendspinPlayerService player = mock(SendspinPlayerService.class);
        when(player.isRunning()).thenReturn(false);
        when(player.getPlayerState()).thenReturn(PlayerState.initial());

        Health health = new SendspinHealthIndicator(player).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("connectionState", "DISCONNECTED");
    }

    @Test
    void shouldReportUpWhileWaitingForController() {
        SendspinPlayerService player = mock(SendspinPlayerService.class);
        when(player.isRunning()).thenReturn(true);
        when(player.getPlayerState()).thenReturn(PlayerState.initial());

        Health health = new SendspinHealthIndicator(player).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).doesNotContainKey("server");
    }

    @Test
    void shouldReportStreamDetailsWhenStreaming() {
        SendspinPlayerService player = mock(SendspinPlayerService.class);
        when(player.isRunning()).thenReturn(true);
        when(player.getPlayerState()).thenReturn(PlayerState.initial()
                .withConnectionState(ConnectionState.STREAMING)
                .withServer("srv", "Living Room")
                .withClock(250L, true)
                .withStream(new StreamConfig("pcm", 48_000, 2, 16))
                .withBufferHealth(42.4f));

        Health health = new SendspinHealthIndicator(player).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("connectionState", "STREAMING")
                .containsEntry("clockSynced", true)
                .containsEntry("streamActive", true)
                .containsEntry("bufferHealthPercent", 42)
                .containsEntry("server", "Living Room");
    }

    @Test
    void shouldReportDegradedAfterSessionError() {
        SendspinPlayerService player = mock(SendspinPlayerService.class);
        when(player.isRunning()).thenReturn(true);
        when(player.getPlayerState()).thenReturn(PlayerState.initial().withError("Transport error: reset"));

        Health health = new SendspinHealthIndicator(player).health();

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("lastError", "Transport error: reset");
    }
}
