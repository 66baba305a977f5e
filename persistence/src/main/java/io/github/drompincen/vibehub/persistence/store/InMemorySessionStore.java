package io.github.drompincen.vibehub.persistence.store;

import io.github.drompincen.vibehub.protocol.api.ContextUsage;
import io.github.drompincen.vibehub.protocol.api.PermissionMode;
import io.github.drompincen.vibehub.protocol.api.StoredMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local session store for development and tests. Activate with {@code vibehub.storage=memory}.
 */
@Service
@ConditionalOnProperty(name = "vibehub.storage", havingValue = "memory")
public class InMemorySessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

    private final Map<String, Entry> sessions = new ConcurrentHashMap<>();
    private volatile GlobalSettings globalSettings = GlobalSettings.empty();

    private static final class Entry {
        final String sessionId;
        final String name;
        final String workingDir;
        final String forkedFrom;
        final Instant createdAt;
        PermissionMode permissionMode;
        String agentConversationId;
        ContextUsage contextUsage;
        Instant lastAccessedAt;
        final List<StoredMessage> messages = new ArrayList<>();
        List<String> allowedTools = new ArrayList<>();
        final List<String> pendingMessages = new ArrayList<>();

        Entry(String sessionId, String name, String workingDir, PermissionMode permissionMode, String forkedFrom) {
            this.sessionId = sessionId;
            this.name = name;
            this.workingDir = workingDir;
            this.permissionMode = permissionMode != null ? permissionMode : PermissionMode.DEFAULT;
            this.forkedFrom = forkedFrom;
            this.createdAt = Instant.now();
            this.lastAccessedAt = createdAt;
        }

        synchronized SessionRecord snapshot() {
            return new SessionRecord(sessionId, name, workingDir, permissionMode, agentConversationId,
                    messages, contextUsage, allowedTools, pendingMessages, forkedFrom, createdAt, lastAccessedAt);
        }
    }

    @Override
    public SessionRecord createSession(String name, String workingDir, PermissionMode permissionMode) {
        Entry entry = new Entry(UUID.randomUUID().toString(), name, workingDir, permissionMode, null);
        sessions.put(entry.sessionId, entry);
        log.info("Created agent session {} ({}) in {}", entry.sessionId, name, workingDir);
        return entry.snapshot();
    }

    @Override
    public Optional<SessionRecord> forkSession(String originalSessionId, String name) {
        Entry original = sessions.get(originalSessionId);
        if (original == null) {
            log.warn("Cannot fork: session {} not found", originalSessionId);
            return Optional.empty();
        }
        String forkName = name != null && !name.isBlank() ? name : original.name + " (fork)";
        Entry fork = new Entry(UUID.randomUUID().toString(), forkName, original.workingDir,
                original.permissionMode, originalSessionId);
        sessions.put(fork.sessionId, fork);
        return Optional.of(fork.snapshot());
    }

    /**
     * Registers a session under a caller-chosen id. Used when another component owns id creation.
     */
    public SessionRecord register(String sessionId, String name, String workingDir, PermissionMode permissionMode) {
        Entry entry = sessions.computeIfAbsent(sessionId, id -> new Entry(id, name, workingDir, permissionMode, null));
        return entry.snapshot();
    }

    @Override
    public Optional<SessionRecord> getSession(String sessionId) {
        Entry entry = sessions.get(sessionId);
        return entry == null ? Optional.empty() : Optional.of(entry.snapshot());
    }

    @Override
    public void updateSession(String sessionId, SessionUpdate update) {
        Entry entry = sessions.get(sessionId);
        if (entry == null || update == null) return;
        synchronized (entry) {
            if (update.agentConversationId() != null) entry.agentConversationId = update.agentConversationId();
            if (update.permissionMode() != null) entry.permissionMode = update.permissionMode();
            if (update.contextUsage() != null) entry.contextUsage = update.contextUsage();
            if (update.allowedTools() != null) entry.allowedTools = new ArrayList<>(update.allowedTools());
        }
    }

    @Override
    public void appendMessage(String sessionId, StoredMessage message) {
        Entry entry = sessions.get(sessionId);
        if (entry == null) return;
        synchronized (entry) {
            entry.messages.add(message);
        }
    }

    @Override
    public void touchSession(String sessionId) {
        Entry entry = sessions.get(sessionId);
        if (entry == null) return;
        synchronized (entry) {
            entry.lastAccessedAt = Instant.now();
        }
    }

    @Override
    public GlobalSettings getGlobalSettings() {
        return globalSettings;
    }

    @Override
    public void setGlobalSettings(GlobalSettings settings) {
        globalSettings = settings != null ? settings : GlobalSettings.empty();
    }

    @Override
    public boolean queueMessage(String sessionId, String message) {
        Entry entry = sessions.get(sessionId);
        if (entry == null) return false;
        synchronized (entry) {
            entry.pendingMessages.add(message);
            log.info("Message queued for session {} (queue length {})", sessionId, entry.pendingMessages.size());
        }
        return true;
    }

    @Override
    public void requeueMessages(String sessionId, List<String> messages) {
        Entry entry = sessions.get(sessionId);
        if (entry == null || messages.isEmpty()) return;
        synchronized (entry) {
            entry.pendingMessages.addAll(0, messages);
        }
    }

    @Override
    public List<String> getPendingMessages(String sessionId) {
        Entry entry = sessions.get(sessionId);
        if (entry == null) return List.of();
        synchronized (entry) {
            List<String> drained = List.copyOf(entry.pendingMessages);
            entry.pendingMessages.clear();
            return drained;
        }
    }
}
