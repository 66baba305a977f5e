package io.github.drompincen.vibehub.runtime.session;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.vibehub.protocol.api.ContextUsage;
import io.github.drompincen.vibehub.protocol.api.PermissionMode;
import io.github.drompincen.vibehub.protocol.api.SessionState;
import io.github.drompincen.vibehub.protocol.api.StoredMessage;
import io.github.drompincen.vibehub.runtime.agent.AgentServiceAdapter;
import io.github.drompincen.vibehub.runtime.permission.PermissionGate;

import java.util.ArrayDeque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory state of one running agent conversation. All mutable fields are guarded by
 * {@link #lock}; the orchestrator is the only writer.
 */
final class ActiveSession {

    private final String sessionId;
    private final String workingDir;
    private final int historyWindow;
    private final ReentrantLock lock = new ReentrantLock();
    private final ArrayDeque<StoredMessage> history = new ArrayDeque<>();

    private long historyBase;
    private long historyLength;
    private String owningConnectionId;
    private String agentConversationId;
    private boolean thinking;
    private boolean aborted;
    private boolean shutDown;
    private PermissionMode permissionMode;
    private ContextUsage contextUsage;
    private List<String> slashCommands = List.of();
    private AgentServiceAdapter adapter;
    private PermissionGate gate;

    ActiveSession(String sessionId, String workingDir, PermissionMode permissionMode, int historyWindow) {
        this.sessionId = sessionId;
        this.workingDir = workingDir;
        this.permissionMode = permissionMode != null ? permissionMode : PermissionMode.DEFAULT;
        this.historyWindow = Math.max(1, historyWindow);
    }

    ReentrantLock lock() { return lock; }

    String sessionId() { return sessionId; }
    String workingDir() { return workingDir; }

    /**
     * Seeds the window from persisted history. {@code tail} must be the last entries of a history
     * of {@code totalLength} entries.
     */
    void loadHistory(List<StoredMessage> tail, long totalLength) {
        history.clear();
        long firstSeq = totalLength - tail.size();
        for (int i = 0; i < tail.size(); i++) {
            history.addLast(tail.get(i).withSeq(firstSeq + i));
        }
        trimHistory();
        historyBase = firstSeq;
        historyLength = totalLength;
    }

    StoredMessage appendHistory(String role, JsonNode content) {
        StoredMessage message = new StoredMessage(historyLength++, role, content, System.currentTimeMillis());
        history.addLast(message);
        trimHistory();
        return message;
    }

    List<StoredMessage> historyWindow() { return List.copyOf(history); }
    long historyLength() { return historyLength; }
    long historyStart() { return historyLength - history.size(); }

    /** Index of the first entry sent on cold start; client message counts are relative to it. */
    long historyBase() { return historyBase; }

    /** Entries a client following this session since its cold start has seen. */
    long messageCount() { return historyLength - historyBase; }

    String owningConnectionId() { return owningConnectionId; }
    void owningConnectionId(String connectionId) { this.owningConnectionId = connectionId; }

    String agentConversationId() { return agentConversationId; }
    void agentConversationId(String id) { this.agentConversationId = id; }

    boolean thinking() { return thinking; }
    void thinking(boolean value) { this.thinking = value; }

    boolean aborted() { return aborted; }
    void aborted(boolean value) { this.aborted = value; }

    boolean shutDown() { return shutDown; }
    void shutDown(boolean value) { this.shutDown = value; }

    PermissionMode permissionMode() { return permissionMode; }
    void permissionMode(PermissionMode mode) { this.permissionMode = mode; }

    ContextUsage contextUsage() { return contextUsage; }
    void contextUsage(ContextUsage usage) { this.contextUsage = usage; }

    List<String> slashCommands() { return slashCommands; }
    void slashCommands(List<String> commands) { this.slashCommands = List.copyOf(commands); }

    AgentServiceAdapter adapter() { return adapter; }
    void adapter(AgentServiceAdapter adapter) { this.adapter = adapter; }

    PermissionGate gate() { return gate; }
    void gate(PermissionGate gate) { this.gate = gate; }

    SessionState state() {
        if (shutDown) return SessionState.SHUT_DOWN;
        if (aborted) return SessionState.ABORTED;
        if (gate != null && gate.pendingCount() > 0) return SessionState.WARM_AWAITING_PERMISSION;
        if (thinking) return SessionState.WARM_THINKING;
        return SessionState.WARM_IDLE;
    }

    private void trimHistory() {
        while (history.size() > historyWindow) {
            history.removeFirst();
        }
    }
}
