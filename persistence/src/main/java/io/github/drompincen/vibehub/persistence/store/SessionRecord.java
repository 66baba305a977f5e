package io.github.drompincen.vibehub.persistence.store;

import io.github.drompincen.vibehub.protocol.api.ContextUsage;
import io.github.drompincen.vibehub.protocol.api.PermissionMode;
import io.github.drompincen.vibehub.protocol.api.StoredMessage;

import java.time.Instant;
import java.util.List;

public record SessionRecord(
        String sessionId,
        String name,
        String workingDir,
        PermissionMode permissionMode,
        String agentConversationId,
        List<StoredMessage> messages,
        ContextUsage contextUsage,
        List<String> allowedTools,
        List<String> pendingMessages,
        String forkedFrom,
        Instant createdAt,
        Instant lastAccessedAt
) {
    public SessionRecord {
        messages = messages != null ? List.copyOf(messages) : List.of();
        allowedTools = allowedTools != null ? List.copyOf(allowedTools) : List.of();
        pendingMessages = pendingMessages != null ? List.copyOf(pendingMessages) : List.of();
    }
}
