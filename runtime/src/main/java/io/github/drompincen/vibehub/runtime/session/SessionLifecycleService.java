package io.github.drompincen.vibehub.runtime.session;

import io.github.drompincen.vibehub.persistence.store.SessionRecord;
import io.github.drompincen.vibehub.persistence.store.SessionStore;
import io.github.drompincen.vibehub.protocol.api.PermissionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Creates, forks and resumes sessions against the store, then hands them to the orchestrator.
 */
@Service
public class SessionLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(SessionLifecycleService.class);

    private final SessionStore sessionStore;
    private final SessionOrchestrator orchestrator;

    public SessionLifecycleService(SessionStore sessionStore, SessionOrchestrator orchestrator) {
        this.sessionStore = sessionStore;
        this.orchestrator = orchestrator;
    }

    public SessionRecord create(String name, String workingDir, PermissionMode permissionMode, String connectionId) {
        if (workingDir == null || workingDir.isBlank()) {
            throw new IllegalArgumentException("workingDir is required");
        }
        PermissionMode mode = permissionMode != null ? permissionMode : PermissionMode.DEFAULT;
        SessionRecord created = sessionStore.createSession(name, workingDir, mode);
        log.info("Created session {} ({}) in {}", created.sessionId(), name, workingDir);
        orchestrator.startOrResumeSession(new StartSessionCommand(
                created.sessionId(), connectionId, workingDir, null, mode, false, null));
        return created;
    }

    /**
     * Branches a session's agent conversation into a new session. The fork gets the original's
     * working directory and permission mode but none of its history.
     *
     * @throws SessionNotFoundException when the original does not exist
     * @throws IllegalStateException    when the original never reached the agent
     */
    public SessionRecord fork(String originalSessionId, String name, String connectionId) {
        SessionRecord original = sessionStore.getSession(originalSessionId)
                .orElseThrow(() -> new SessionNotFoundException(originalSessionId));
        String conversationId = orchestrator.getAgentConversationId(originalSessionId)
                .orElse(original.agentConversationId());
        if (conversationId == null) {
            throw new IllegalStateException("Cannot fork session " + originalSessionId + ": no agent conversation yet");
        }
        SessionRecord fork = sessionStore.forkSession(originalSessionId, name)
                .orElseThrow(() -> new SessionNotFoundException(originalSessionId));
        log.info("Forked session {} from {} (agent conversation {})", fork.sessionId(), originalSessionId, conversationId);
        orchestrator.startOrResumeSession(new StartSessionCommand(
                fork.sessionId(), connectionId, fork.workingDir(), conversationId, fork.permissionMode(), true, null));
        return fork;
    }

    /**
     * Attaches the connection to a session, cold-starting it from the store when it is not active.
     * A session the store does not know starts fresh with empty history; without a
     * {@code fallbackWorkingDir} its agent runs in the server's working directory.
     *
     * @param fallbackWorkingDir used when the store has no record of the session
     */
    public void resume(String sessionId, String connectionId, String fallbackWorkingDir, Long clientMessageCount) {
        if (orchestrator.isSessionActive(sessionId)) {
            orchestrator.startOrResumeSession(StartSessionCommand.resume(sessionId, connectionId, clientMessageCount));
            return;
        }

        Optional<SessionRecord> stored = sessionStore.getSession(sessionId);
        String workingDir = stored.map(SessionRecord::workingDir).orElse(fallbackWorkingDir);
        if (stored.isEmpty()) {
            log.warn("Session {} has no stored record, starting fresh in {}", sessionId,
                    workingDir != null ? workingDir : "the server working directory");
        }
        String resumeToken = stored.map(SessionRecord::agentConversationId).orElse(null);
        PermissionMode mode = stored.map(SessionRecord::permissionMode).orElse(null);
        orchestrator.startOrResumeSession(new StartSessionCommand(
                sessionId, connectionId, workingDir, resumeToken, mode, false, clientMessageCount));
    }

    /**
     * Sends a user prompt, or queues it if the session is not active.
     *
     * @return true when the agent accepted the prompt now
     */
    public boolean sendUserMessage(String sessionId, String content) {
        if (orchestrator.isSessionActive(sessionId)) {
            return orchestrator.sendMessage(sessionId, content, false);
        }
        if (!sessionStore.queueMessage(sessionId, content)) {
            throw new SessionNotFoundException(sessionId);
        }
        log.info("Session {} not active, message queued", sessionId);
        return false;
    }
}
