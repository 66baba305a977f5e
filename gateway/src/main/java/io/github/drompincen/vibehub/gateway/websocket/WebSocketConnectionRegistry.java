package io.github.drompincen.vibehub.gateway.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.vibehub.protocol.ws.WsMessage;
import io.github.drompincen.vibehub.runtime.transport.SessionEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open websocket connections by id. Sends are serialized per connection by
 * {@link ConcurrentWebSocketSessionDecorator}, so agent threads and request threads can both write.
 */
@Component
public class WebSocketConnectionRegistry implements SessionEventSink {

    private static final Logger log = LoggerFactory.getLogger(WebSocketConnectionRegistry.class);

    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ObjectMapper objectMapper;
    private final Map<String, WebSocketSession> connections = new ConcurrentHashMap<>();

    public WebSocketConnectionRegistry(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void register(WebSocketSession session) {
        connections.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
        log.debug("Connection {} registered", session.getId());
    }

    public void unregister(String connectionId) {
        connections.remove(connectionId);
    }

    public int connectionCount() {
        return connections.size();
    }

    @Override
    public void send(String connectionId, WsMessage message) {
        WebSocketSession connection = connections.get(connectionId);
        if (connection == null || !connection.isOpen()) {
            log.debug("Connection {} gone, dropping {}", connectionId, message.type());
            return;
        }
        try {
            connection.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} for connection {}", message.type(), connectionId, e);
        } catch (IOException e) {
            log.warn("Failed to send {} to connection {}: {}", message.type(), connectionId, e.getMessage());
        }
    }
}
