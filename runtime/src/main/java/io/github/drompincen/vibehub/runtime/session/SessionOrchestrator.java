package io.github.drompincen.vibehub.runtime.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.vibehub.persistence.store.SessionRecord;
import io.github.drompincen.vibehub.persistence.store.SessionStore;
import io.github.drompincen.vibehub.persistence.store.SessionUpdate;
import io.github.drompincen.vibehub.protocol.api.ContextUsage;
import io.github.drompincen.vibehub.protocol.api.DeliveryResult;
import io.github.drompincen.vibehub.protocol.api.PermissionDecision;
import io.github.drompincen.vibehub.protocol.api.PermissionMode;
import io.github.drompincen.vibehub.protocol.api.PermissionResult;
import io.github.drompincen.vibehub.protocol.api.SessionState;
import io.github.drompincen.vibehub.protocol.api.SessionStatusDto;
import io.github.drompincen.vibehub.protocol.api.StoredMessage;
import io.github.drompincen.vibehub.protocol.event.AgentEvent;
import io.github.drompincen.vibehub.protocol.ws.WsMessage;
import io.github.drompincen.vibehub.protocol.ws.WsMessageType;
import io.github.drompincen.vibehub.runtime.agent.AgentCallbacks;
import io.github.drompincen.vibehub.runtime.agent.AgentOptions;
import io.github.drompincen.vibehub.runtime.agent.AgentServiceAdapter;
import io.github.drompincen.vibehub.runtime.agent.AgentServiceFactory;
import io.github.drompincen.vibehub.runtime.permission.GlobalAllowlist;
import io.github.drompincen.vibehub.runtime.permission.PendingPermission;
import io.github.drompincen.vibehub.runtime.permission.PermissionGate;
import io.github.drompincen.vibehub.runtime.transport.SessionEventSink;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns every active agent session: routes agent events to the owning connection, gates tool use
 * through each session's {@link PermissionGate}, replays missed state on reconnect and hands
 * messages between sessions.
 *
 * <p>Each session is guarded by its own lock; there is no lock spanning sessions.
 */
@Service
public class SessionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SessionOrchestrator.class);

    static final String ABORT_REASON = "Session aborted";
    static final String SHUTDOWN_REASON = "Server shutdown";

    private final Map<String, ActiveSession> sessions = new ConcurrentHashMap<>();
    private final SessionStore sessionStore;
    private final GlobalAllowlist globalAllowlist;
    private final AgentServiceFactory agentServiceFactory;
    private final SessionEventSink eventSink;
    private final SessionProperties properties;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean shutDown = new AtomicBoolean();

    public SessionOrchestrator(SessionStore sessionStore,
                               GlobalAllowlist globalAllowlist,
                               AgentServiceFactory agentServiceFactory,
                               SessionEventSink eventSink,
                               SessionProperties properties,
                               ObjectMapper objectMapper) {
        this.sessionStore = sessionStore;
        this.globalAllowlist = globalAllowlist;
        this.agentServiceFactory = agentServiceFactory;
        this.eventSink = eventSink;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    // --- lifecycle ---

    /**
     * Attaches {@code command.connectionId()} to the session, cold-starting it if it is not active.
     * Never throws; failures are reported to the connection as {@code ERROR} events.
     */
    public void startOrResumeSession(StartSessionCommand command) {
        if (shutDown.get()) {
            log.warn("Refusing to start session {} during shutdown", command.sessionId());
            eventSink.send(command.connectionId(), WsMessage.error(command.sessionId(), "Server is shutting down"));
            return;
        }
        ActiveSession existing = sessions.get(command.sessionId());
        if (existing != null) {
            resume(existing, command);
            return;
        }
        try {
            coldStart(command);
        } catch (RuntimeException e) {
            log.error("Failed to start session {}", command.sessionId(), e);
            eventSink.send(command.connectionId(),
                    WsMessage.error(command.sessionId(), "Failed to start session: " + e.getMessage()));
        }
    }

    private void resume(ActiveSession session, StartSessionCommand command) {
        session.lock().lock();
        try {
            String previous = session.owningConnectionId();
            session.owningConnectionId(command.connectionId());
            log.info("Session {} resumed by connection {} (previous owner {})",
                    session.sessionId(), command.connectionId(), previous);
            relay(session, WsMessageType.SESSION_READY, sessionReadyPayload(session));
            replay(session, command.clientMessageCount());
            relay(session, WsMessageType.THINKING, thinkingPayload(session.thinking()));
        } finally {
            session.lock().unlock();
        }
    }

    private void coldStart(StartSessionCommand command) {
        String sessionId = command.sessionId();
        Optional<SessionRecord> stored = loadStored(sessionId);

        List<StoredMessage> persisted = stored.map(SessionRecord::messages).orElse(List.of());
        int window = properties.getHistoryWindow();
        List<StoredMessage> tail = persisted.size() > window
                ? persisted.subList(persisted.size() - window, persisted.size())
                : persisted;

        PermissionMode mode = command.permissionMode() != null
                ? command.permissionMode()
                : stored.map(SessionRecord::permissionMode).orElse(PermissionMode.DEFAULT);
        String workingDir = command.workingDir() != null
                ? command.workingDir()
                : stored.map(SessionRecord::workingDir).orElse(null);

        ActiveSession session = new ActiveSession(sessionId, workingDir, mode, window);
        session.loadHistory(tail, persisted.size());
        stored.map(SessionRecord::contextUsage).ifPresent(session::contextUsage);
        stored.map(SessionRecord::agentConversationId).ifPresent(session::agentConversationId);

        List<String> allowedTools = stored.map(SessionRecord::allowedTools).orElse(List.of());
        session.gate(new PermissionGate(sessionId, globalAllowlist, new GateListener(session), allowedTools));
        AgentOptions options = new AgentOptions(workingDir, command.resumeToken(), command.fork(), mode);
        session.adapter(agentServiceFactory.create(options, new SessionCallbacks(sessionId)));

        ActiveSession raced = sessions.putIfAbsent(sessionId, session);
        if (raced != null) {
            log.debug("Session {} was started concurrently, resuming instead", sessionId);
            resume(raced, command);
            return;
        }
        if (shutDown.get()) {
            sessions.remove(sessionId, session);
            teardown(session, SHUTDOWN_REASON);
            return;
        }

        session.lock().lock();
        try {
            session.owningConnectionId(command.connectionId());
            log.info("Session {} started for connection {} ({} history entries, resume={}, fork={})",
                    sessionId, command.connectionId(), persisted.size(), command.resumeToken(), command.fork());
            relay(session, WsMessageType.SESSION_READY, sessionReadyPayload(session));
            replay(session, command.clientMessageCount());
        } finally {
            session.lock().unlock();
        }

        drainPendingMessages(sessionId);
    }

    /**
     * Clears ownership for every session owned by a closed connection. The sessions keep running.
     */
    public void detachConnection(String connectionId) {
        for (ActiveSession session : sessions.values()) {
            session.lock().lock();
            try {
                if (connectionId.equals(session.owningConnectionId())) {
                    session.owningConnectionId(null);
                    log.info("Connection {} detached from session {}", connectionId, session.sessionId());
                }
            } finally {
                session.lock().unlock();
            }
        }
    }

    // --- messaging ---

    /**
     * Starts an agent query for {@code content}.
     *
     * @param relayToClient echo the message to the owner as a programmatic user message
     * @return false when a query is already in flight or the adapter refused to start
     * @throws SessionNotFoundException when the session is not active
     */
    public boolean sendMessage(String sessionId, String content, boolean relayToClient) {
        ActiveSession session = requireSession(sessionId);
        session.lock().lock();
        try {
            AgentServiceAdapter adapter = session.adapter();
            if (adapter.isActive()) {
                log.warn("Cannot send message to session {} while agent is processing", sessionId);
                return false;
            }

            StoredMessage message = session.appendHistory(StoredMessage.ROLE_USER, TextNode.valueOf(content));
            if (relayToClient) {
                relay(session, WsMessageType.MESSAGE, messagePayload(message, false, true));
            }
            persist(sessionId, "user message", () -> sessionStore.appendMessage(sessionId, message));
            persist(sessionId, "last access", () -> sessionStore.touchSession(sessionId));
            session.aborted(false);
            updateThinking(session, true);

            try {
                adapter.start(content);
            } catch (RuntimeException e) {
                log.error("Agent failed to start for session {}", sessionId, e);
                relay(session, WsMessageType.ERROR, errorPayload(e.getMessage()));
                updateThinking(session, false);
                return false;
            }
            log.debug("Agent query started for session {}", sessionId);
            return true;
        } finally {
            session.lock().unlock();
        }
    }

    /**
     * Hands {@code text} to another session: delivered now if it is idle, queued otherwise.
     */
    public DeliveryResult sendMessageToSession(String targetSessionId, String text) {
        ActiveSession session = sessions.get(targetSessionId);
        if (session != null) {
            boolean busy;
            session.lock().lock();
            try {
                busy = session.thinking() || session.gate().pendingCount() > 0 || session.adapter().isActive();
            } finally {
                session.lock().unlock();
            }
            if (!busy) {
                try {
                    if (sendMessage(targetSessionId, text, false)) {
                        log.info("Delivered cross-session message to {}", targetSessionId);
                        return DeliveryResult.deliveredNow();
                    }
                } catch (SessionNotFoundException e) {
                    log.debug("Session {} ended before delivery, queueing", targetSessionId);
                }
            }
        }
        return queue(targetSessionId, text);
    }

    private DeliveryResult queue(String sessionId, String text) {
        try {
            if (!sessionStore.queueMessage(sessionId, text)) {
                return DeliveryResult.failed("Session not found");
            }
        } catch (RuntimeException e) {
            log.error("Failed to queue message for session {}", sessionId, e);
            return DeliveryResult.failed("Failed to queue message: " + e.getMessage());
        }
        log.info("Queued cross-session message for {}", sessionId);
        return DeliveryResult.queuedForLater();
    }

    /**
     * Delivers queued messages in order until the agent becomes busy; the rest go back to the
     * front of the queue for the next drain.
     */
    void drainPendingMessages(String sessionId) {
        if (!sessions.containsKey(sessionId)) {
            return;
        }
        List<String> pending;
        try {
            pending = sessionStore.getPendingMessages(sessionId);
        } catch (RuntimeException e) {
            log.error("Failed to read queued messages for session {}", sessionId, e);
            return;
        }
        if (pending.isEmpty()) {
            return;
        }
        log.info("Draining {} queued messages for session {}", pending.size(), sessionId);

        for (int i = 0; i < pending.size(); i++) {
            boolean delivered;
            try {
                delivered = sendMessage(sessionId, pending.get(i), true);
            } catch (RuntimeException e) {
                log.error("Failed to deliver queued message to session {}", sessionId, e);
                delivered = false;
            }
            if (!delivered) {
                List<String> remaining = List.copyOf(pending.subList(i, pending.size()));
                persist(sessionId, "requeue", () -> sessionStore.requeueMessages(sessionId, remaining));
                return;
            }
        }
    }

    // --- agent events ---

    public void recordAgentEvent(String sessionId, AgentEvent event) {
        ActiveSession session = sessions.get(sessionId);
        if (session == null) {
            log.warn("Dropping {} event for inactive session {}", event.kind(), sessionId);
            return;
        }

        boolean drainAfter;
        session.lock().lock();
        try {
            drainAfter = switch (event.kind()) {
                case SYSTEM_INIT -> {
                    onSystemInit(session, (AgentEvent.SystemInit) event);
                    yield false;
                }
                case ASSISTANT -> {
                    onAssistantMessage(session, (AgentEvent.AssistantMessage) event);
                    yield false;
                }
                case USER -> {
                    onUserMessage(session, (AgentEvent.UserMessage) event);
                    yield false;
                }
                case RESULT -> {
                    onResult(session, (AgentEvent.Result) event);
                    yield true;
                }
            };
        } finally {
            session.lock().unlock();
        }

        if (drainAfter) {
            drainPendingMessages(sessionId);
        }
    }

    private void onSystemInit(ActiveSession session, AgentEvent.SystemInit init) {
        String sessionId = session.sessionId();
        session.agentConversationId(init.conversationId());
        session.slashCommands(init.slashCommands());
        log.info("Session {} bound to agent conversation {}", sessionId, init.conversationId());
        if (!init.slashCommands().isEmpty()) {
            relay(session, WsMessageType.SLASH_COMMANDS, slashCommandsPayload(init.slashCommands()));
        }
        updateThinking(session, true);
        if (init.conversationId() != null) {
            persist(sessionId, "agent conversation id",
                    () -> sessionStore.updateSession(sessionId, SessionUpdate.agentConversationId(init.conversationId())));
        }
    }

    private void onAssistantMessage(ActiveSession session, AgentEvent.AssistantMessage assistant) {
        String sessionId = session.sessionId();
        StoredMessage message = session.appendHistory(StoredMessage.ROLE_ASSISTANT, assistant.content());
        persist(sessionId, "assistant message", () -> sessionStore.appendMessage(sessionId, message));
        relay(session, WsMessageType.MESSAGE, messagePayload(message, false, false));
    }

    private void onUserMessage(ActiveSession session, AgentEvent.UserMessage user) {
        String invocationId = user.toolInvocationId();
        if (user.hasToolResult() && invocationId != null) {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("invocationId", invocationId);
            payload.set("result", user.toolUseResult());
            relay(session, WsMessageType.TOOL_RESULT, payload);
        }
        if (user.replay()) {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("role", StoredMessage.ROLE_USER);
            payload.set("content", user.message() != null ? user.message().path("content") : null);
            payload.put("replay", true);
            relay(session, WsMessageType.MESSAGE, payload);
        }
    }

    private void onResult(ActiveSession session, AgentEvent.Result result) {
        String sessionId = session.sessionId();
        forceThinking(session, false);

        long contextWindow = result.modelContextWindow() != null && result.modelContextWindow() > 0
                ? result.modelContextWindow()
                : properties.getDefaultContextWindow();
        ContextUsage usage = new ContextUsage(
                result.inputTokens() + result.cacheReadInputTokens(), contextWindow, result.totalCostUsd());
        session.contextUsage(usage);
        log.info("Session {} query finished: {} / {} tokens ({}%), ${}",
                sessionId, usage.tokensUsed(), usage.contextWindow(), usage.percentUsed(), usage.costUsd());

        persist(sessionId, "context usage", () -> sessionStore.updateSession(sessionId, SessionUpdate.contextUsage(usage)));
        relay(session, WsMessageType.RESULT, resultPayload(usage, result.usage(), result.modelUsage(), false));
    }

    private void onAgentError(String sessionId, Throwable error) {
        ActiveSession session = sessions.get(sessionId);
        if (session == null) {
            log.warn("Agent error for inactive session {}: {}", sessionId, error.getMessage());
            return;
        }
        log.error("Agent error in session {}", sessionId, error);
        session.lock().lock();
        try {
            relay(session, WsMessageType.ERROR, errorPayload(error.getMessage()));
            if (!session.adapter().isActive()) {
                updateThinking(session, false);
            }
        } finally {
            session.lock().unlock();
        }
    }

    private void onAgentComplete(String sessionId) {
        ActiveSession session = sessions.get(sessionId);
        if (session == null) {
            return;
        }
        session.lock().lock();
        try {
            // a drained message may already have started the next query
            if (!session.adapter().isActive()) {
                forceThinking(session, false);
            }
        } finally {
            session.lock().unlock();
        }
    }

    // --- permissions ---

    /**
     * Gate entry point for the agent adapter. The returned stage completes when a human decides,
     * or exceptionally when the session is aborted or the server shuts down.
     */
    public CompletionStage<PermissionResult> handlePermissionRequest(String sessionId, String toolName,
                                                                     JsonNode input, String invocationId) {
        ActiveSession session = sessions.get(sessionId);
        if (session == null) {
            log.warn("Permission request {} for inactive session {}", invocationId, sessionId);
            return CompletableFuture.failedFuture(new SessionNotFoundException(sessionId));
        }
        session.lock().lock();
        try {
            return session.gate().requestPermission(toolName, input, invocationId);
        } finally {
            session.lock().unlock();
        }
    }

    /**
     * @return false when the invocation is not pending (already decided or unknown)
     * @throws SessionNotFoundException when the session is not active
     */
    public boolean respondToPermission(String sessionId, String invocationId, PermissionDecision decision) {
        ActiveSession session = requireSession(sessionId);
        session.lock().lock();
        try {
            boolean rendered = session.gate().renderDecision(invocationId, decision);
            if (rendered) {
                forceThinking(session, true);
            }
            return rendered;
        } finally {
            session.lock().unlock();
        }
    }

    public void setPermissionMode(String sessionId, PermissionMode mode) {
        ActiveSession session = sessions.get(sessionId);
        if (session != null) {
            session.lock().lock();
            try {
                session.permissionMode(mode);
                session.adapter().setPermissionMode(mode);
            } finally {
                session.lock().unlock();
            }
        }
        log.info("Permission mode for session {} set to {}", sessionId, mode.wireName());
        persist(sessionId, "permission mode", () -> sessionStore.updateSession(sessionId, SessionUpdate.permissionMode(mode)));
    }

    public List<String> getAllowedTools(String sessionId) {
        ActiveSession session = sessions.get(sessionId);
        if (session != null) {
            return session.gate().sessionAllowlist();
        }
        return loadStored(sessionId).map(SessionRecord::allowedTools).orElse(List.of());
    }

    public List<String> setAllowedTools(String sessionId, Collection<String> tools) {
        List<String> updated = List.copyOf(tools);
        ActiveSession session = sessions.get(sessionId);
        if (session != null) {
            session.gate().setSessionAllowlist(updated);
        }
        log.info("Session {} allowlist replaced ({} patterns)", sessionId, updated.size());
        persist(sessionId, "allowed tools", () -> sessionStore.updateSession(sessionId, SessionUpdate.allowedTools(updated)));
        return updated;
    }

    public List<String> getGlobalAllowedTools() {
        return globalAllowlist.list();
    }

    public List<String> setGlobalAllowedTools(Collection<String> tools) {
        globalAllowlist.replace(tools);
        return globalAllowlist.list();
    }

    // --- abort and shutdown ---

    /**
     * Interrupts the in-flight query and rejects pending permissions. The session stays active.
     *
     * @return false when the session is not active
     */
    public boolean abortSession(String sessionId) {
        ActiveSession session = sessions.get(sessionId);
        if (session == null) {
            log.warn("Abort requested for inactive session {}", sessionId);
            return false;
        }
        session.lock().lock();
        try {
            abortAdapter(session);
            updateThinking(session, false);
            int rejected = session.gate().rejectAll(ABORT_REASON);
            session.aborted(true);
            log.info("Session {} aborted ({} pending permissions rejected)", sessionId, rejected);
        } finally {
            session.lock().unlock();
        }
        return true;
    }

    @PreDestroy
    public void shutdown() {
        if (!shutDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down {} active sessions", sessions.size());
        for (ActiveSession session : sessions.values()) {
            teardown(session, SHUTDOWN_REASON);
        }
        sessions.clear();
    }

    private void teardown(ActiveSession session, String reason) {
        session.lock().lock();
        try {
            abortAdapter(session);
            session.gate().rejectAll(reason);
            session.thinking(false);
            session.shutDown(true);
        } finally {
            session.lock().unlock();
        }
    }

    private void abortAdapter(ActiveSession session) {
        try {
            session.adapter().abort();
        } catch (RuntimeException e) {
            log.error("Agent abort failed for session {}", session.sessionId(), e);
        }
    }

    // --- queries ---

    public boolean isSessionActive(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    public int getActiveSessionCount() {
        return sessions.size();
    }

    public List<String> getActiveSessionIds() {
        return List.copyOf(sessions.keySet());
    }

    public Optional<String> getAgentConversationId(String sessionId) {
        ActiveSession session = sessions.get(sessionId);
        if (session == null) return Optional.empty();
        session.lock().lock();
        try {
            return Optional.ofNullable(session.agentConversationId());
        } finally {
            session.lock().unlock();
        }
    }

    public Optional<String> getWorkingDir(String sessionId) {
        ActiveSession session = sessions.get(sessionId);
        return session != null ? Optional.ofNullable(session.workingDir()) : Optional.empty();
    }

    public SessionStatusDto getStatus(String sessionId) {
        ActiveSession session = sessions.get(sessionId);
        if (session == null) {
            boolean exists = loadStored(sessionId).isPresent();
            return new SessionStatusDto(sessionId, exists, false, false, false, 0, 0, SessionState.COLD);
        }
        session.lock().lock();
        try {
            int pending = session.gate().pendingCount();
            return new SessionStatusDto(sessionId, true, true, session.thinking(), pending > 0, pending,
                    session.messageCount(), session.state());
        } finally {
            session.lock().unlock();
        }
    }

    // --- replay and relay ---

    private void replay(ActiveSession session, Long clientMessageCount) {
        ReplayPlan plan = ReplayPlan.compute(session.historyWindow(), session.historyBase(),
                session.historyLength(), clientMessageCount);
        if (!plan.isEmpty()) {
            log.debug("Replaying {} messages from index {} to session {}",
                    plan.messages().size(), plan.startIndex(), session.sessionId());
        }
        for (StoredMessage message : plan.messages()) {
            relay(session, WsMessageType.MESSAGE, messagePayload(message, true, false));
        }
        if (session.contextUsage() != null) {
            relay(session, WsMessageType.RESULT, resultPayload(session.contextUsage(), null, null, true));
        }
        for (PendingPermission pending : session.gate().pending()) {
            relay(session, WsMessageType.PERMISSION_REQUEST, permissionRequestPayload(pending));
        }
        if (!session.slashCommands().isEmpty()) {
            relay(session, WsMessageType.SLASH_COMMANDS, slashCommandsPayload(session.slashCommands()));
        }
    }

    private void relay(ActiveSession session, WsMessageType type, JsonNode payload) {
        String connectionId = session.owningConnectionId();
        if (connectionId == null) {
            log.debug("Session {} has no owning connection, dropping {}", session.sessionId(), type);
            return;
        }
        try {
            eventSink.send(connectionId, WsMessage.of(type, session.sessionId(), payload));
        } catch (RuntimeException e) {
            log.warn("Failed to relay {} for session {} to connection {}", type, session.sessionId(), connectionId, e);
        }
    }

    private void updateThinking(ActiveSession session, boolean thinking) {
        if (session.thinking() != thinking) {
            forceThinking(session, thinking);
        }
    }

    private void forceThinking(ActiveSession session, boolean thinking) {
        session.thinking(thinking);
        relay(session, WsMessageType.THINKING, thinkingPayload(thinking));
    }

    // --- payloads ---

    private ObjectNode sessionReadyPayload(ActiveSession session) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("permissionMode", session.permissionMode().wireName());
        payload.put("historyLength", session.historyLength());
        payload.put("historyStart", session.historyStart());
        payload.put("messageCount", session.messageCount());
        if (session.agentConversationId() != null) {
            payload.put("agentConversationId", session.agentConversationId());
        }
        return payload;
    }

    private ObjectNode messagePayload(StoredMessage message, boolean replay, boolean programmatic) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("seq", message.seq());
        payload.put("role", message.role());
        payload.set("content", message.content());
        payload.put("timestamp", message.timestamp());
        payload.put("replay", replay);
        if (programmatic) {
            payload.put("programmatic", true);
        }
        return payload;
    }

    private ObjectNode resultPayload(ContextUsage usage, JsonNode rawUsage, JsonNode modelUsage, boolean replay) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("tokensUsed", usage.tokensUsed());
        payload.put("contextWindow", usage.contextWindow());
        payload.put("costUsd", usage.costUsd());
        payload.put("percentUsed", usage.percentUsed());
        if (rawUsage != null) payload.set("usage", rawUsage);
        if (modelUsage != null) payload.set("modelUsage", modelUsage);
        payload.put("replay", replay);
        return payload;
    }

    private ObjectNode permissionRequestPayload(PendingPermission pending) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("invocationId", pending.invocationId());
        payload.put("toolName", pending.toolName());
        payload.set("input", pending.input());
        payload.put("requestedAt", pending.requestedAt().toString());
        return payload;
    }

    private ObjectNode slashCommandsPayload(List<String> commands) {
        ObjectNode payload = objectMapper.createObjectNode();
        ArrayNode array = payload.putArray("commands");
        commands.forEach(array::add);
        return payload;
    }

    private ObjectNode toolsPayload(List<String> tools) {
        ObjectNode payload = objectMapper.createObjectNode();
        ArrayNode array = payload.putArray("tools");
        tools.forEach(array::add);
        return payload;
    }

    private ObjectNode thinkingPayload(boolean thinking) {
        return objectMapper.createObjectNode().put("thinking", thinking);
    }

    private ObjectNode errorPayload(String message) {
        return objectMapper.createObjectNode().put("message", message != null ? message : "Unknown agent error");
    }

    // --- helpers ---

    private ActiveSession requireSession(String sessionId) {
        ActiveSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    private Optional<SessionRecord> loadStored(String sessionId) {
        try {
            return sessionStore.getSession(sessionId);
        } catch (RuntimeException e) {
            log.error("Failed to load session {} from store", sessionId, e);
            return Optional.empty();
        }
    }

    private void persist(String sessionId, String what, Runnable write) {
        try {
            write.run();
        } catch (RuntimeException e) {
            log.error("Failed to persist {} for session {}", what, sessionId, e);
        }
    }

    /**
     * Routes one session's gate notifications to its owner.
     */
    private final class GateListener implements PermissionGate.Listener {

        private final ActiveSession session;

        GateListener(ActiveSession session) {
            this.session = session;
        }

        @Override
        public void onPermissionRequested(PendingPermission pending) {
            relay(session, WsMessageType.PERMISSION_REQUEST, permissionRequestPayload(pending));
        }

        @Override
        public void onSessionAllowlistChanged(List<String> tools) {
            String sessionId = session.sessionId();
            persist(sessionId, "allowed tools", () -> sessionStore.updateSession(sessionId, SessionUpdate.allowedTools(tools)));
            relay(session, WsMessageType.ALLOWED_TOOLS, toolsPayload(tools));
        }

        @Override
        public void onGlobalAllowlistChanged(List<String> tools) {
            relay(session, WsMessageType.GLOBAL_ALLOWED_TOOLS, toolsPayload(tools));
        }
    }

    /**
     * Adapter callbacks bound to one session id.
     */
    private final class SessionCallbacks implements AgentCallbacks {

        private final String sessionId;

        SessionCallbacks(String sessionId) {
            this.sessionId = sessionId;
        }

        @Override
        public void onEvent(AgentEvent event) {
            recordAgentEvent(sessionId, event);
        }

        @Override
        public CompletionStage<PermissionResult> onPermissionRequest(String toolName, JsonNode input, String invocationId) {
            return handlePermissionRequest(sessionId, toolName, input, invocationId);
        }

        @Override
        public void onError(Throwable error) {
            onAgentError(sessionId, error);
        }

        @Override
        public void onComplete() {
            onAgentComplete(sessionId);
        }
    }
}
