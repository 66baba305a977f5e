package io.github.drompincen.vibehub.runtime.agent;

import io.github.drompincen.vibehub.protocol.api.PermissionMode;

/**
 * @param workingDir     directory the agent runs in
 * @param resumeToken    agent conversation id to resume, {@code null} for a new conversation
 * @param fork           branch off {@code resumeToken} instead of continuing it
 * @param permissionMode initial permission mode
 */
public record AgentOptions(
        String workingDir,
        String resumeToken,
        boolean fork,
        PermissionMode permissionMode
) {
    public AgentOptions {
        if (permissionMode == null) permissionMode = PermissionMode.DEFAULT;
    }
}
