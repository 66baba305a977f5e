package io.github.drompincen.vibehub.persistence.document;

import io.github.drompincen.vibehub.protocol.api.ContextUsage;
import io.github.drompincen.vibehub.protocol.api.PermissionMode;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Document(collection = "agent_sessions")
public class AgentSessionDocument {

    @Id
    private String sessionId;

    private String name;
    private String workingDir;
    private PermissionMode permissionMode;
    private String agentConversationId;
    private List<MessageEntry> messages = new ArrayList<>();
    private ContextUsage contextUsage;
    private List<String> allowedTools = new ArrayList<>();
    private List<String> pendingMessages = new ArrayList<>();

    @Indexed
    private String forkedFrom;

    private Instant createdAt;

    @Indexed(direction = org.springframework.data.mongodb.core.index.IndexDirection.DESCENDING)
    private Instant lastAccessedAt;

    public AgentSessionDocument() {}

    /**
     * History entries keep their content as serialized JSON, since it is either a string or an
     * array of content blocks.
     */
    public static class MessageEntry {
        private long seq;
        private String role;
        private String contentJson;
        private long timestamp;

        public MessageEntry() {}

        public long getSeq() { return seq; }
        public void setSeq(long seq) { this.seq = seq; }

        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }

        public String getContentJson() { return contentJson; }
        public void setContentJson(String contentJson) { this.contentJson = contentJson; }

        public long getTimestamp() { return timestamp; }
        public void setTimestamp(long timestamp) { this.timestamp = timestamp; }
    }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getWorkingDir() { return workingDir; }
    public void setWorkingDir(String workingDir) { this.workingDir = workingDir; }

    public PermissionMode getPermissionMode() { return permissionMode; }
    public void setPermissionMode(PermissionMode permissionMode) { this.permissionMode = permissionMode; }

    public String getAgentConversationId() { return agentConversationId; }
    public void setAgentConversationId(String agentConversationId) { this.agentConversationId = agentConversationId; }

    public List<MessageEntry> getMessages() { return messages; }
    public void setMessages(List<MessageEntry> messages) { this.messages = messages; }

    public ContextUsage getContextUsage() { return contextUsage; }
    public void setContextUsage(ContextUsage contextUsage) { this.contextUsage = contextUsage; }

    public List<String> getAllowedTools() { return allowedTools; }
    public void setAllowedTools(List<String> allowedTools) { this.allowedTools = allowedTools; }

    public List<String> getPendingMessages() { return pendingMessages; }
    public void setPendingMessages(List<String> pendingMessages) { this.pendingMessages = pendingMessages; }

    public String getForkedFrom() { return forkedFrom; }
    public void setForkedFrom(String forkedFrom) { this.forkedFrom = forkedFrom; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getLastAccessedAt() { return lastAccessedAt; }
    public void setLastAccessedAt(Instant lastAccessedAt) { this.lastAccessedAt = lastAccessedAt; }
}
