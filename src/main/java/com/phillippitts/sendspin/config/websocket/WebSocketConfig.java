package com.phillippitts.sendspin.config.websocket;

import com.phillippitts.sendspin.config.properties.SendspinProperties;
import com.phillippitts.sendspin.websocket.SendspinWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the player endpoint.
 *
 * <p>Controllers connect to {@code sendspin.path} (advertised in the mDNS TXT record); the
 * root path is accepted too for controllers configured by host and port only. Audio frames
 * can be large, so the binary buffer is 1 MiB.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    static final int MAX_BINARY_MESSAGE_BYTES = 1024 * 1024;
    static final int MAX_TEXT_MESSAGE_BYTES = 1024 * 1024;
    static final long IDLE_TIMEOUT_MS = 30_000;

    private final SendspinWebSocketHandler handler;
    private final SendspinProperties props;

    public WebSocketConfig(SendspinWebSocketHandler handler, SendspinProperties props) {
        this.handler = handler;
        this.props = props;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, props.getPath(), "/")
                .setAllowedOriginPatterns("*");
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxBinaryMessageBufferSize(MAX_BINARY_MESSAGE_BYTES);
        container.setMaxTextMessageBufferSize(MAX_TEXT_MESSAGE_BYTES);
        container.setMaxSessionIdleTimeout(IDLE_TIMEOUT_MS);
        return container;
    }
}
