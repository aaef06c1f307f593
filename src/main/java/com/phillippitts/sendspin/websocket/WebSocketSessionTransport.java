package com.phillippitts.sendspin.websocket;

import com.phillippitts.sendspin.service.session.SessionTransport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * {@link SessionTransport} over a Spring {@link WebSocketSession}. The session passed in must
 * already serialize concurrent sends (see {@code ConcurrentWebSocketSessionDecorator}).
 */
final class WebSocketSessionTransport implements SessionTransport {

    private static final Logger LOG = LogManager.getLogger(WebSocketSessionTransport.class);

    private final WebSocketSession session;

    WebSocketSessionTransport(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void sendText(String text) throws IOException {
        session.sendMessage(new TextMessage(text));
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void close() {
        try {
            session.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            LOG.debug("Error closing WebSocket {}: {}", session.getId(), e.toString());
        }
    }
}
