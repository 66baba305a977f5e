package io.github.drompincen.vibehub.gateway.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.vibehub.persistence.store.SessionRecord;
import io.github.drompincen.vibehub.protocol.api.PermissionBehavior;
import io.github.drompincen.vibehub.protocol.api.PermissionDecision;
import io.github.drompincen.vibehub.protocol.api.PermissionMode;
import io.github.drompincen.vibehub.protocol.ws.WsMessage;
import io.github.drompincen.vibehub.protocol.ws.WsMessageType;
import io.github.drompincen.vibehub.runtime.session.SessionLifecycleService;
import io.github.drompincen.vibehub.runtime.session.SessionNotFoundException;
import io.github.drompincen.vibehub.runtime.session.SessionOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.ArrayList;
import java.util.List;

/**
 * Client actions over {@code /ws}. Frames are {@code {type, sessionId, payload}}; every reply and
 * every agent event goes to a single connection through {@link WebSocketConnectionRegistry}.
 */
@Component
public class SessionWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(SessionWebSocketHandler.class);

    private final ObjectMapper objectMapper;
    private final WebSocketConnectionRegistry connections;
    private final SessionOrchestrator orchestrator;
    private final SessionLifecycleService lifecycle;

    public SessionWebSocketHandler(ObjectMapper objectMapper,
                                   WebSocketConnectionRegistry connections,
                                   SessionOrchestrator orchestrator,
                                   SessionLifecycleService lifecycle) {
        this.objectMapper = objectMapper;
        this.connections = connections;
        this.orchestrator = orchestrator;
        this.lifecycle = lifecycle;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        connections.register(session);
        log.info("Connection {} opened", session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        connections.unregister(session.getId());
        orchestrator.detachConnection(session.getId());
        log.info("Connection {} closed ({})", session.getId(), status.getCode());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String connectionId = session.getId();
        JsonNode frame;
        try {
            frame = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.warn("Malformed frame from connection {}: {}", connectionId, e.getOriginalMessage());
            reply(connectionId, WsMessage.error(null, "Malformed message"));
            return;
        }

        String sessionId = frame.hasNonNull("sessionId") ? frame.get("sessionId").asText() : null;
        JsonNode payload = frame.path("payload");
        WsMessageType type = parseType(frame.path("type").asText());
        if (type == null || !type.isClientAction()) {
            reply(connectionId, WsMessage.error(sessionId, "Unknown action: " + frame.path("type").asText()));
            return;
        }

        try {
            dispatch(connectionId, type, sessionId, payload);
        } catch (SessionNotFoundException e) {
            log.warn("{} from connection {}: {}", type, connectionId, e.getMessage());
            reply(connectionId, WsMessage.error(sessionId, e.getMessage()));
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.warn("{} from connection {} rejected: {}", type, connectionId, e.getMessage());
            reply(connectionId, WsMessage.error(sessionId, e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Failed to handle {} from connection {}", type, connectionId, e);
            reply(connectionId, WsMessage.error(sessionId, "Failed to handle " + type + ": " + e.getMessage()));
        }
    }

    private void dispatch(String connectionId, WsMessageType type, String sessionId, JsonNode payload) {
        switch (type) {
            case CREATE_SESSION -> {
                SessionRecord created = lifecycle.create(
                        textOrNull(payload, "name"),
                        textOrNull(payload, "workingDir"),
                        PermissionMode.fromWire(textOrNull(payload, "permissionMode")),
                        connectionId);
                reply(connectionId, WsMessage.of(WsMessageType.SESSION_CREATED, created.sessionId(), sessionSummary(created)));
            }
            case START_SESSION, RESUME_SESSION -> lifecycle.resume(
                    requireSessionId(sessionId), connectionId, textOrNull(payload, "workingDir"), messageCount(payload));
            case FORK_SESSION -> {
                SessionRecord fork = lifecycle.fork(requireSessionId(sessionId), textOrNull(payload, "name"), connectionId);
                ObjectNode summary = sessionSummary(fork);
                summary.put("forkedFrom", sessionId);
                reply(connectionId, WsMessage.of(WsMessageType.SESSION_FORKED, fork.sessionId(), summary));
            }
            case SEND_MESSAGE -> {
                String content = textOrNull(payload, "content");
                if (content == null || content.isBlank()) {
                    throw new IllegalArgumentException("content is required");
                }
                boolean accepted = lifecycle.sendUserMessage(requireSessionId(sessionId), content);
                if (!accepted) {
                    log.debug("Message from {} to session {} not started, agent busy", connectionId, sessionId);
                }
            }
            case PERMISSION_RESPONSE -> {
                String invocationId = textOrNull(payload, "invocationId");
                if (invocationId == null) {
                    throw new IllegalArgumentException("invocationId is required");
                }
                boolean rendered = orchestrator.respondToPermission(requireSessionId(sessionId), invocationId, decision(payload));
                if (!rendered) {
                    log.debug("Permission {} already resolved, ignoring response from {}", invocationId, connectionId);
                }
            }
            case ABORT -> {
                boolean aborted = orchestrator.abortSession(requireSessionId(sessionId));
                reply(connectionId, WsMessage.of(WsMessageType.ABORTED, sessionId,
                        objectMapper.createObjectNode().put("aborted", aborted)));
            }
            case SET_PERMISSION_MODE -> {
                PermissionMode mode = PermissionMode.fromWire(textOrNull(payload, "permissionMode"));
                orchestrator.setPermissionMode(requireSessionId(sessionId), mode);
                reply(connectionId, WsMessage.of(WsMessageType.PERMISSION_MODE_UPDATED, sessionId,
                        objectMapper.createObjectNode().put("permissionMode", mode.wireName())));
            }
            case GET_ALLOWED_TOOLS -> reply(connectionId, WsMessage.of(WsMessageType.ALLOWED_TOOLS, sessionId,
                    toolsPayload(orchestrator.getAllowedTools(requireSessionId(sessionId)))));
            case SET_ALLOWED_TOOLS -> reply(connectionId, WsMessage.of(WsMessageType.ALLOWED_TOOLS, sessionId,
                    toolsPayload(orchestrator.setAllowedTools(requireSessionId(sessionId), tools(payload)))));
            case GET_GLOBAL_ALLOWED_TOOLS -> reply(connectionId, WsMessage.of(WsMessageType.GLOBAL_ALLOWED_TOOLS, null,
                    toolsPayload(orchestrator.getGlobalAllowedTools())));
            case SET_GLOBAL_ALLOWED_TOOLS -> reply(connectionId, WsMessage.of(WsMessageType.GLOBAL_ALLOWED_TOOLS, null,
                    toolsPayload(orchestrator.setGlobalAllowedTools(tools(payload)))));
            case GET_STATUS -> reply(connectionId, WsMessage.of(WsMessageType.STATUS, sessionId,
                    objectMapper.valueToTree(orchestrator.getStatus(requireSessionId(sessionId)))));
            default -> reply(connectionId, WsMessage.error(sessionId, "Unsupported action: " + type));
        }
    }

    private PermissionDecision decision(JsonNode payload) {
        PermissionBehavior behavior = "allow".equalsIgnoreCase(payload.path("behavior").asText())
                ? PermissionBehavior.ALLOW
                : PermissionBehavior.DENY;
        JsonNode updatedInput = payload.hasNonNull("updatedInput") ? payload.get("updatedInput") : null;
        return new PermissionDecision(
                behavior,
                updatedInput,
                textOrNull(payload, "message"),
                payload.path("remember").asBoolean(false),
                payload.path("global").asBoolean(false));
    }

    private void reply(String connectionId, WsMessage message) {
        connections.send(connectionId, message);
    }

    private ObjectNode sessionSummary(SessionRecord record) {
        ObjectNode summary = objectMapper.createObjectNode();
        summary.put("sessionId", record.sessionId());
        summary.put("name", record.name());
        summary.put("workingDir", record.workingDir());
        summary.put("permissionMode", record.permissionMode().wireName());
        return summary;
    }

    private ObjectNode toolsPayload(List<String> tools) {
        ObjectNode payload = objectMapper.createObjectNode();
        ArrayNode array = payload.putArray("tools");
        tools.forEach(array::add);
        return payload;
    }

    private static List<String> tools(JsonNode payload) {
        JsonNode array = payload.path("tools");
        if (!array.isArray()) {
            throw new IllegalArgumentException("tools must be an array");
        }
        List<String> tools = new ArrayList<>();
        array.forEach(node -> tools.add(node.asText()));
        return tools;
    }

    private static Long messageCount(JsonNode payload) {
        JsonNode count = payload.path("messageCount");
        return count.canConvertToLong() ? count.asLong() : null;
    }

    private static String requireSessionId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        return sessionId;
    }

    private static String textOrNull(JsonNode payload, String field) {
        return payload.hasNonNull(field) ? payload.get(field).asText() : null;
    }

    private static WsMessageType parseType(String type) {
        try {
            return WsMessageType.valueOf(type);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
