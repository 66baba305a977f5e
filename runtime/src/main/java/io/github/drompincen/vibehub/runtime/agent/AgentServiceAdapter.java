package io.github.drompincen.vibehub.runtime.agent;

import io.github.drompincen.vibehub.protocol.api.PermissionMode;

/**
 * One backing agent conversation. Implementations deliver their output through the
 * {@link AgentCallbacks} they were created with.
 *
 * <p>Contract relied on by the orchestrator:
 * <ul>
 *   <li>{@link #start} returns promptly; the query runs on another thread;</li>
 *   <li>{@link #isActive} is true from the return of {@code start} until just before the
 *       {@code Result} event (or an error) is delivered;</li>
 *   <li>a second {@code start} while active throws {@link AgentServiceException}.</li>
 * </ul>
 */
public interface AgentServiceAdapter {

    void start(String prompt);

    /**
     * Interrupts the in-flight query, if any. Safe to call when idle.
     */
    void abort();

    void setPermissionMode(PermissionMode mode);

    boolean isActive();

    /**
     * Conversation id reported by the runtime's latest init event, {@code null} before the first one.
     */
    String getConversationId();
}
