package com.phillippitts.sendspin;

import com.phillippitts.sendspin.config.IntegrationTestConfiguration;
import com.phillippitts.sendspin.domain.ConnectionState;
import com.phillippitts.sendspin.service.orchestration.SendspinPlayerService;
import com.phillippitts.sendspin.service.playback.PlaybackEngine;
import com.phillippitts.sendspin.service.protocol.SendspinProtocol;
import com.phillippitts.sendspin.testutil.FakeAudioOutput;
import com.phillippitts.sendspin.testutil.FakeAudioOutputFactory;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@Tag("integration")
@ActiveProfiles("test")
@Import(IntegrationTestConfiguration.class)
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class SendspinApplicationTests {

    @LocalServerPort
    int port;

    @Autowired
    SendspinPlayerService player;

    @Autowired
    PlaybackEngine playback;

    @Autowired
    FakeAudioOutputFactory outputFactory;

    private WebSocketSession controller;

    @AfterEach
    void closeController() throws Exception {
        if (controller != null && controller.isOpen()) {
            controller.close(CloseStatus.NORMAL);
        }
    }

    @Test
    void contextLoads() {
        assertThat(player.isRunning()).isTrue();
    }

    @Test
    void controllerCanHandshakeStreamAndControlVolume() throws Exception {
        ControllerHandler inbox = new ControllerHandler();
        controller = new StandardWebSocketClient()
                .execute(inbox, "ws://localhost:" + port + SendspinProtocol.DEFAULT_PATH)
                .get(5, TimeUnit.SECONDS);

        JSONObject hello = inbox.next("client/hello");
        assertThat(hello.getJSONObject("payload").getJSONArray("supported_roles").toList())
                .containsExactly("player@v1");

        send(new JSONObject().put("type", "server/hello").put("payload", new JSONObject()
                .put("server_id", "it-server").put("name", "Integration").put("version", 1)));

        // Echo every clock request with the controller clock equal to the player clock
        for (int i = 0; i < 3; i++) {
            long t0 = inbox.next("client/time").getJSONObject("payload").getLong("client_transmitted");
            send(new JSONObject().put("type", "server/time").put("payload", new JSONObject()
                    .put("client_transmitted", t0)
                    .put("server_received", t0)
                    .put("server_transmitted", t0)));
        }
        JSONObject state = inbox.next("client/state");
        assertThat(state.getJSONObject("payload").getJSONObject("player").getString("state"))
                .isEqualTo("synchronized");
        await().atMost(Duration.ofSeconds(5)).until(player::isConnected);

        send(new JSONObject().put("type", "stream/start").put("payload", new JSONObject()
                .put("player", new JSONObject()
                        .put("codec", "pcm").put("sample_rate", 48_000).put("channels", 2).put("bit_depth", 16))));
        await().atMost(Duration.ofSeconds(5)).until(player::isStreaming);

        long serverNow = System.nanoTime() / 1_000;
        controller.sendMessage(new BinaryMessage(SendspinProtocol.audioFrame(serverNow, new byte[192])));
        await().atMost(Duration.ofSeconds(5)).until(() -> {
            FakeAudioOutput out = outputFactory.last();
            return out != null && !out.writes().isEmpty();
        });

        send(new JSONObject().put("type", "server/command").put("payload", new JSONObject()
                .put("player", new JSONObject().put("command", "volume").put("volume", 40))));
        JSONObject volumeState = inbox.next("client/state");
        assertThat(volumeState.getJSONObject("payload").getJSONObject("player").getInt("volume")).isEqualTo(40);
        await().atMost(Duration.ofSeconds(5)).until(() -> Math.abs(playback.getVolume() - 0.4f) < 0.001f);

        send(new JSONObject().put("type", "stream/end")
                .put("payload", new JSONObject().put("roles", new JSONArray(List.of("player")))));
        await().atMost(Duration.ofSeconds(5)).until(() -> !playback.isPlaying());

        controller.close(CloseStatus.NORMAL);
        await().atMost(Duration.ofSeconds(5))
                .until(() -> player.getPlayerState().connectionState() == ConnectionState.DISCONNECTED);
    }

    private void send(JSONObject message) throws Exception {
        controller.sendMessage(new TextMessage(message.toString()));
    }

    /** Collects the player's text frames. */
    static final class ControllerHandler extends TextWebSocketHandler {
        private final BlockingQueue<JSONObject> received = new LinkedBlockingQueue<>();

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            received.add(new JSONObject(message.getPayload()));
        }

        /** Next frame of {@code type}, skipping others. */
        JSONObject next(String type) throws InterruptedException {
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (System.nanoTime() < deadline) {
                JSONObject msg = received.poll(100, TimeUnit.MILLISECONDS);
                if (msg != null && type.equals(msg.optString("type"))) {
                    return msg;
                }
            }
            throw new AssertionError("No " + type + " within 5 seconds");
        }
    }
}
