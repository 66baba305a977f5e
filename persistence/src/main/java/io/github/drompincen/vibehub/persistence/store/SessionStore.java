package io.github.drompincen.vibehub.persistence.store;

import io.github.drompincen.vibehub.protocol.api.PermissionMode;
import io.github.drompincen.vibehub.protocol.api.StoredMessage;

import java.util.List;
import java.util.Optional;

/**
 * Durable mirror of agent session metadata. The store never holds authoritative in-memory state:
 * callers write the fields they own and read them back on cold start.
 */
public interface SessionStore {

    SessionRecord createSession(String name, String workingDir, PermissionMode permissionMode);

    /**
     * Creates a new session that branches from {@code originalSessionId}. Only the working directory
     * and permission mode are copied; history, usage and allow-lists start empty.
     */
    Optional<SessionRecord> forkSession(String originalSessionId, String name);

    Optional<SessionRecord> getSession(String sessionId);

    /**
     * Applies the non-null fields of {@code update}. Unknown sessions are ignored.
     */
    void updateSession(String sessionId, SessionUpdate update);

    /**
     * Appends to the unbounded persisted history.
     */
    void appendMessage(String sessionId, StoredMessage message);

    void touchSession(String sessionId);

    GlobalSettings getGlobalSettings();

    void setGlobalSettings(GlobalSettings settings);

    /**
     * Queues a message for delivery to {@code sessionId}.
     *
     * @return false when the session does not exist
     */
    boolean queueMessage(String sessionId, String message);

    /**
     * Puts messages back at the front of the queue, preserving their order.
     */
    void requeueMessages(String sessionId, List<String> messages);

    /**
     * Returns and clears the queued messages, in enqueue order.
     */
    List<String> getPendingMessages(String sessionId);
}
