package io.github.drompincen.vibehub.persistence.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.vibehub.persistence.document.AgentSessionDocument;
import io.github.drompincen.vibehub.persistence.document.GlobalSettingsDocument;
import io.github.drompincen.vibehub.persistence.repository.AgentSessionRepository;
import io.github.drompincen.vibehub.persistence.repository.GlobalSettingsRepository;
import io.github.drompincen.vibehub.protocol.api.PermissionMode;
import io.github.drompincen.vibehub.protocol.api.StoredMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoDB-backed session store. Single-field writes go through {@link MongoTemplate} updates so that
 * concurrent writers for different fields of one session never overwrite each other.
 */
@Service
@ConditionalOnProperty(name = "vibehub.storage", havingValue = "mongo", matchIfMissing = true)
public class MongoSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(MongoSessionStore.class);

    private final AgentSessionRepository sessionRepository;
    private final GlobalSettingsRepository settingsRepository;
    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoSessionStore(AgentSessionRepository sessionRepository,
                             GlobalSettingsRepository settingsRepository,
                             MongoTemplate mongoTemplate,
                             ObjectMapper objectMapper) {
        this.sessionRepository = sessionRepository;
        this.settingsRepository = settingsRepository;
        this.mongoTemplate = mongoTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public SessionRecord createSession(String name, String workingDir, PermissionMode permissionMode) {
        AgentSessionDocument doc = new AgentSessionDocument();
        doc.setSessionId(UUID.randomUUID().toString());
        doc.setName(name);
        doc.setWorkingDir(workingDir);
        doc.setPermissionMode(permissionMode != null ? permissionMode : PermissionMode.DEFAULT);
        doc.setCreatedAt(Instant.now());
        doc.setLastAccessedAt(doc.getCreatedAt());
        AgentSessionDocument saved = sessionRepository.save(doc);
        log.info("Created agent session {} ({}) in {}", saved.getSessionId(), name, workingDir);
        return toRecord(saved);
    }

    @Override
    public Optional<SessionRecord> forkSession(String originalSessionId, String name) {
        Optional<AgentSessionDocument> original = sessionRepository.findById(originalSessionId);
        if (original.isEmpty()) {
            log.warn("Cannot fork: session {} not found", originalSessionId);
            return Optional.empty();
        }
        AgentSessionDocument source = original.get();
        AgentSessionDocument fork = new AgentSessionDocument();
        fork.setSessionId(UUID.randomUUID().toString());
        fork.setName(name != null && !name.isBlank() ? name : source.getName() + " (fork)");
        fork.setWorkingDir(source.getWorkingDir());
        fork.setPermissionMode(source.getPermissionMode());
        fork.setForkedFrom(originalSessionId);
        fork.setCreatedAt(Instant.now());
        fork.setLastAccessedAt(fork.getCreatedAt());
        AgentSessionDocument saved = sessionRepository.save(fork);
        log.info("Forked agent session {} into {}", originalSessionId, saved.getSessionId());
        return Optional.of(toRecord(saved));
    }

    @Override
    public Optional<SessionRecord> getSession(String sessionId) {
        return sessionRepository.findById(sessionId).map(this::toRecord);
    }

    @Override
    public void updateSession(String sessionId, SessionUpdate update) {
        if (update == null || update.isEmpty()) return;
        Update u = new Update();
        if (update.agentConversationId() != null) u.set("agentConversationId", update.agentConversationId());
        if (update.permissionMode() != null) u.set("permissionMode", update.permissionMode());
        if (update.contextUsage() != null) u.set("contextUsage", update.contextUsage());
        if (update.allowedTools() != null) u.set("allowedTools", update.allowedTools());
        mongoTemplate.updateFirst(byId(sessionId), u, AgentSessionDocument.class);
    }

    @Override
    public void appendMessage(String sessionId, StoredMessage message) {
        mongoTemplate.updateFirst(byId(sessionId), new Update().push("messages", toEntry(message)),
                AgentSessionDocument.class);
    }

    @Override
    public void touchSession(String sessionId) {
        mongoTemplate.updateFirst(byId(sessionId), new Update().set("lastAccessedAt", Instant.now()),
                AgentSessionDocument.class);
    }

    @Override
    public GlobalSettings getGlobalSettings() {
        return settingsRepository.findById(GlobalSettingsDocument.GLOBAL_ID)
                .map(doc -> new GlobalSettings(doc.getAllowedTools()))
                .orElseGet(GlobalSettings::empty);
    }

    @Override
    public void setGlobalSettings(GlobalSettings settings) {
        GlobalSettingsDocument doc = new GlobalSettingsDocument();
        doc.setSettingsId(GlobalSettingsDocument.GLOBAL_ID);
        doc.setAllowedTools(new ArrayList<>(settings.allowedTools()));
        doc.setUpdatedAt(Instant.now());
        settingsRepository.save(doc);
    }

    @Override
    public boolean queueMessage(String sessionId, String message) {
        var result = mongoTemplate.updateFirst(byId(sessionId), new Update().push("pendingMessages", message),
                AgentSessionDocument.class);
        boolean queued = result.getMatchedCount() > 0;
        if (queued) {
            log.info("Message queued for session {}", sessionId);
        }
        return queued;
    }

    @Override
    public void requeueMessages(String sessionId, List<String> messages) {
        if (messages.isEmpty()) return;
        Update u = new Update();
        u.push("pendingMessages").atPosition(Update.Position.FIRST).each(messages.toArray());
        mongoTemplate.updateFirst(byId(sessionId), u, AgentSessionDocument.class);
    }

    @Override
    public List<String> getPendingMessages(String sessionId) {
        Query query = byId(sessionId);
        query.addCriteria(where("pendingMessages.0").exists(true));
        AgentSessionDocument before = mongoTemplate.findAndModify(query,
                new Update().set("pendingMessages", List.of()),
                FindAndModifyOptions.options().returnNew(false),
                AgentSessionDocument.class);
        if (before == null || before.getPendingMessages() == null) {
            return List.of();
        }
        log.info("Drained {} pending messages for session {}", before.getPendingMessages().size(), sessionId);
        return List.copyOf(before.getPendingMessages());
    }

    private static Query byId(String sessionId) {
        return new Query(where("_id").is(sessionId));
    }

    SessionRecord toRecord(AgentSessionDocument doc) {
        List<StoredMessage> messages = new ArrayList<>();
        if (doc.getMessages() != null) {
            for (AgentSessionDocument.MessageEntry entry : doc.getMessages()) {
                messages.add(new StoredMessage(entry.getSeq(), entry.getRole(),
                        readContent(entry.getContentJson()), entry.getTimestamp()));
            }
        }
        return new SessionRecord(
                doc.getSessionId(),
                doc.getName(),
                doc.getWorkingDir(),
                doc.getPermissionMode() != null ? doc.getPermissionMode() : PermissionMode.DEFAULT,
                doc.getAgentConversationId(),
                messages,
                doc.getContextUsage(),
                doc.getAllowedTools(),
                doc.getPendingMessages(),
                doc.getForkedFrom(),
                doc.getCreatedAt(),
                doc.getLastAccessedAt());
    }

    AgentSessionDocument.MessageEntry toEntry(StoredMessage message) {
        AgentSessionDocument.MessageEntry entry = new AgentSessionDocument.MessageEntry();
        entry.setSeq(message.seq());
        entry.setRole(message.role());
        entry.setTimestamp(message.timestamp());
        try {
            entry.setContentJson(objectMapper.writeValueAsString(message.content()));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize message content for seq {}, storing as text", message.seq());
            entry.setContentJson(objectMapper.valueToTree(String.valueOf(message.content())).toString());
        }
        return entry;
    }

    private JsonNode readContent(String json) {
        if (json == null) return TextNode.valueOf("");
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Stored message content is not valid JSON, returning raw text");
            return TextNode.valueOf(json);
        }
    }
}
