package io.github.drompincen.vibehub.persistence.repository;

import io.github.drompincen.vibehub.persistence.document.AgentSessionDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface AgentSessionRepository extends MongoRepository<AgentSessionDocument, String> {
    List<AgentSessionDocument> findAllByOrderByLastAccessedAtDesc();
    List<AgentSessionDocument> findByForkedFrom(String forkedFrom);
}
