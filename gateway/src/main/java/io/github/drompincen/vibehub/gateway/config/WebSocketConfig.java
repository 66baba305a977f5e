package io.github.drompincen.vibehub.gateway.config;

import io.github.drompincen.vibehub.gateway.websocket.SessionWebSocketHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Mounts the session socket. Every client action and every relayed agent event
 * travels over this single endpoint.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private static final Logger log = LoggerFactory.getLogger(WebSocketConfig.class);

    private final SessionWebSocketHandler handler;
    private final GatewayProperties properties;

    public WebSocketConfig(SessionWebSocketHandler handler, GatewayProperties properties) {
        this.handler = handler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        String[] origins = properties.getAllowedOrigins().toArray(new String[0]);
        registry.addHandler(handler, properties.getWebsocketPath()).setAllowedOrigins(origins);
        log.info("Session socket mounted at {} (origins {})",
                properties.getWebsocketPath(), properties.getAllowedOrigins());
    }

    @Bean
    ServletServerContainerFactoryBean webSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(properties.getMaxTextMessageBytes());
        if (properties.getIdleTimeoutMillis() > 0) {
            container.setMaxSessionIdleTimeout(properties.getIdleTimeoutMillis());
        }
        return container;
    }
}
