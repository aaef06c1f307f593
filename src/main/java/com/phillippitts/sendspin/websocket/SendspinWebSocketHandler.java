package com.phillippitts.sendspin.websocket;

import com.phillippitts.sendspin.service.orchestration.SendspinPlayerService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Bridges Spring WebSocket callbacks to {@link SendspinPlayerService}.
 *
 * <p>Every new connection becomes the active session. Exceptions escaping message dispatch
 * fail the session and close the socket with SERVER_ERROR; they never reach the container.
 * The server pings every connection periodically so dead peers are detected by the idle
 * timeout.
 */
@Component
public class SendspinWebSocketHandler extends AbstractWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(SendspinWebSocketHandler.class);

    static final Duration PING_INTERVAL = Duration.ofSeconds(15);
    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final int SEND_BUFFER_LIMIT_BYTES = 512 * 1024;

    private final SendspinPlayerService player;
    private final TaskScheduler scheduler;
    private final Map<String, ScheduledFuture<?>> pings = new ConcurrentHashMap<>();

    public SendspinWebSocketHandler(SendspinPlayerService player,
                                    @Qualifier("sendspinScheduler") TaskScheduler scheduler) {
        this.player = player;
        this.scheduler = scheduler;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        LOG.info("Controller connected: id={} remote={}", session.getId(), session.getRemoteAddress());
        WebSocketSession safe = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS,
                SEND_BUFFER_LIMIT_BYTES);
        pings.put(session.getId(), scheduler.scheduleAtFixedRate(() -> ping(safe), PING_INTERVAL));
        guarded(session, () -> player.acceptSession(new WebSocketSessionTransport(safe)));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        guarded(session, () -> player.onText(session.getId(), message.getPayload()));
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        ByteBuffer payload = message.getPayload();
        guarded(session, () -> player.onBinary(session.getId(), payload));
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        LOG.trace("Pong from {}", session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        LOG.warn("Transport error on {}: {}", session.getId(), exception.toString());
        player.onTransportError(session.getId(), "Transport error: " + exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        cancelPing(session.getId());
        LOG.info("Controller disconnected: id={} status={}", session.getId(), status);
        if (isOrderly(status)) {
            player.onClosed(session.getId());
        } else {
            player.onTransportError(session.getId(), "Connection closed abnormally: " + status);
        }
    }

    static boolean isOrderly(CloseStatus status) {
        return status.equalsCode(CloseStatus.NORMAL) || status.equalsCode(CloseStatus.GOING_AWAY);
    }

    private void guarded(WebSocketSession session, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            LOG.error("Unhandled error in session {}", session.getId(), e);
            player.onTransportError(session.getId(), "Unhandled error: " + e);
            closeQuietly(session, CloseStatus.SERVER_ERROR);
        }
    }

    private void ping(WebSocketSession session) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.sendMessage(new PingMessage());
        } catch (IOException | IllegalStateException e) {
            LOG.debug("Ping to {} failed: {}", session.getId(), e.toString());
        }
    }

    private void cancelPing(String sessionId) {
        ScheduledFuture<?> f = pings.remove(sessionId);
        if (f != null) {
            f.cancel(false);
        }
    }

    private static void closeQuietly(WebSocketSession session, CloseStatus status) {
        try {
            session.close(status);
        } catch (IOException e) {
            LOG.debug("Error closing {}: {}", session.getId(), e.toString());
        }
    }
}
