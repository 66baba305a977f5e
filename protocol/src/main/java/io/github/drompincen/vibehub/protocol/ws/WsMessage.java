package io.github.drompincen.vibehub.protocol.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

public record WsMessage(
        WsMessageType type,
        String sessionId,
        JsonNode payload,
        Instant ts
) {
    public static WsMessage of(WsMessageType type, String sessionId, JsonNode payload) {
        return new WsMessage(type, sessionId, payload, Instant.now());
    }

    public static WsMessage error(String sessionId, JsonNode payload) {
        return of(WsMessageType.ERROR, sessionId, payload);
    }

    public static WsMessage error(String sessionId, String message) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("message", message != null ? message : "Unknown error");
        return error(sessionId, payload);
    }
}
