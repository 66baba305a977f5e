package io.github.drompincen.vibehub.persistence.store;

import io.github.drompincen.vibehub.protocol.api.ContextUsage;
import io.github.drompincen.vibehub.protocol.api.PermissionMode;

import java.util.List;

/**
 * Partial session metadata write; {@code null} fields are left untouched.
 */
public record SessionUpdate(
        String agentConversationId,
        PermissionMode permissionMode,
        ContextUsage contextUsage,
        List<String> allowedTools
) {
    public static SessionUpdate agentConversationId(String agentConversationId) {
        return new SessionUpdate(agentConversationId, null, null, null);
    }

    public static SessionUpdate permissionMode(PermissionMode permissionMode) {
        return new SessionUpdate(null, permissionMode, null, null);
    }

    public static SessionUpdate contextUsage(ContextUsage contextUsage) {
        return new SessionUpdate(null, null, contextUsage, null);
    }

    public static SessionUpdate allowedTools(List<String> allowedTools) {
        return new SessionUpdate(null, null, null, List.copyOf(allowedTools));
    }

    public boolean isEmpty() {
        return agentConversationId == null && permissionMode == null && contextUsage == null && allowedTools == null;
    }
}
