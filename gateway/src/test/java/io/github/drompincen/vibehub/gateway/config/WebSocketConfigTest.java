package io.github.drompincen.vibehub.gateway.config;

import io.github.drompincen.vibehub.gateway.websocket.SessionWebSocketHandler;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistration;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class WebSocketConfigTest {

    @Test
    void handlerIsMountedOnConfiguredPathAndOrigins() {
        SessionWebSocketHandler handler = mock(SessionWebSocketHandler.class);
        GatewayProperties properties = new GatewayProperties();
        properties.setWebsocketPath("/sessions");
        properties.setAllowedOrigins(List.of("http://localhost:5173", "http://127.0.0.1:5173"));

        WebSocketHandlerRegistry registry = mock(WebSocketHandlerRegistry.class);
        WebSocketHandlerRegistration registration = mock(WebSocketHandlerRegistration.class);
        when(registry.addHandler(any(), any(String[].class))).thenReturn(registration);

        new WebSocketConfig(handler, properties).registerWebSocketHandlers(registry);

        verify(registry).addHandler(eq(handler), eq("/sessions"));
        verify(registration).setAllowedOrigins("http://localhost:5173", "http://127.0.0.1:5173");
    }
}
