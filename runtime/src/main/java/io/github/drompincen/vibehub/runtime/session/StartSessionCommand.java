package io.github.drompincen.vibehub.runtime.session;

import io.github.drompincen.vibehub.protocol.api.PermissionMode;

/**
 * @param sessionId          session to start or resume
 * @param connectionId       connection that becomes the owner
 * @param workingDir         used only on cold start
 * @param resumeToken        agent conversation id to resume on cold start
 * @param permissionMode     initial mode on cold start; {@code null} uses the stored mode
 * @param fork               branch the agent conversation instead of continuing it
 * @param clientMessageCount number of history entries the client shows since the session's cold start
 *                           (the {@code messageCount} of {@code SESSION_READY} plus live entries since),
 *                           {@code null} if unknown
 */
public record StartSessionCommand(
        String sessionId,
        String connectionId,
        String workingDir,
        String resumeToken,
        PermissionMode permissionMode,
        boolean fork,
        Long clientMessageCount
) {
    public static StartSessionCommand resume(String sessionId, String connectionId, Long clientMessageCount) {
        return new StartSessionCommand(sessionId, connectionId, null, null, null, false, clientMessageCount);
    }
}
